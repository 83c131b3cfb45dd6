package com.schemeengine.order;

/**
 * Outcome of an attempt to complete a buy or sell.
 */
public enum OrderStatus {
    /**
     * The order filled and the scheme advanced.
     */
    FILLED,

    /**
     * The order has not filled yet. The scheme is unchanged.
     */
    NOT_FILLED
}

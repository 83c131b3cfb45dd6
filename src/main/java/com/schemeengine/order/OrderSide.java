package com.schemeengine.order;

/**
 * Side of an order placed against the external market.
 */
public enum OrderSide {
    BUY,
    SELL
}

package com.schemeengine.refund;

/**
 * Which refund algorithm closed a scheme.
 */
public enum RedemptionMode {
    /**
     * The position was never acquired. Contributions returned 1:1.
     */
    PRE_PURCHASE,

    /**
     * The position was sold. Proceeds distributed pro-rata to shareholders.
     */
    POST_SALE
}

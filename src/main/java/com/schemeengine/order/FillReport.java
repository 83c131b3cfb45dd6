package com.schemeengine.order;

import lombok.Value;

import java.math.BigInteger;

/**
 * Result of polling an order gateway for a fill.
 */
@Value
public class FillReport {
    boolean filled;
    BigInteger price;

    public static FillReport filled(BigInteger price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Fill price must be non-negative");
        }
        return new FillReport(true, price);
    }

    public static FillReport notFilled() {
        return new FillReport(false, BigInteger.ZERO);
    }
}

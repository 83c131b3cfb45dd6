package com.schemeengine.refund;

import lombok.Value;

import java.math.BigInteger;

/**
 * What one participant gave up and received when a scheme closed.
 */
@Value
public class Payout {
    String participant;

    /**
     * Ledger balance burned.
     */
    BigInteger burned;

    /**
     * Settlement amount paid, including any dust.
     */
    BigInteger paid;
}

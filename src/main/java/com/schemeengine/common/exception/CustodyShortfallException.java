package com.schemeengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a scheme's custody balance cannot cover the payouts an operation owes.
 * Raised before any payout is made.
 */
public class CustodyShortfallException extends SchemeEngineException {

    public CustodyShortfallException(String schemeId, BigInteger required, BigInteger custody) {
        super(String.format("Custody of scheme %s cannot cover payouts. Required: %s, Custody: %s",
            schemeId, required, custody));
    }
}

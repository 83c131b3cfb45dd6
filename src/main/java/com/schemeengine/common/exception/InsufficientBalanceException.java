package com.schemeengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a holder's ledger balance cannot cover a burn or transfer.
 */
public class InsufficientBalanceException extends SchemeEngineException {

    public InsufficientBalanceException(String holder, BigInteger required, BigInteger available) {
        super(String.format("Insufficient balance for %s. Required: %s, Available: %s",
            holder, required, available));
    }
}

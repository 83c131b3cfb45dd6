package com.schemeengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a spender's allowance cannot cover a delegated transfer.
 */
public class InsufficientAllowanceException extends SchemeEngineException {

    public InsufficientAllowanceException(String owner, String spender, BigInteger required, BigInteger allowed) {
        super(String.format("Insufficient allowance from %s to %s. Required: %s, Allowed: %s",
            owner, spender, required, allowed));
    }
}

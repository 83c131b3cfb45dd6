package com.schemeengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when the settlement asset refuses or fails a transfer.
 *
 * This aborts the whole containing operation; the surrounding transaction
 * rolls back every ledger change made before the failure.
 */
public class SettlementTransferException extends SchemeEngineException {

    private final String source;
    private final String destination;

    public SettlementTransferException(String source, String destination, BigInteger amount) {
        super(String.format("Settlement transfer of %s from %s to %s failed", amount, source, destination));
        this.source = source;
        this.destination = destination;
    }

    public SettlementTransferException(String message, String source, String destination, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.destination = destination;
    }

    public String getSource() {
        return source;
    }

    public String getDestination() {
        return destination;
    }
}

package com.schemeengine.scheme.event;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Shares moved between two holders.
 */
@Getter
@ToString(callSuper = true)
public class TransferEvent extends SchemeEvent {

    private final String from;
    private final String to;
    private final BigInteger amount;

    public TransferEvent(String schemeId, String from, String to, BigInteger amount, Instant occurredAt) {
        super(schemeId, occurredAt);
        this.from = from;
        this.to = to;
        this.amount = amount;
    }
}

package com.schemeengine.scheme.event;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.time.Instant;

/**
 * An owner set the allowance of a spender.
 */
@Getter
@ToString(callSuper = true)
public class ApprovalEvent extends SchemeEvent {

    private final String owner;
    private final String spender;
    private final BigInteger amount;

    public ApprovalEvent(String schemeId, String owner, String spender, BigInteger amount, Instant occurredAt) {
        super(schemeId, occurredAt);
        this.owner = owner;
        this.spender = spender;
        this.amount = amount;
    }
}

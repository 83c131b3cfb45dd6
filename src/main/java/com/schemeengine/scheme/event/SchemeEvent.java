package com.schemeengine.scheme.event;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Advisory notification emitted by a scheme operation.
 *
 * Events are published only after the operation that produced them commits.
 * Listeners observe; they never influence the scheme.
 */
@Getter
@ToString
public abstract class SchemeEvent {

    private final String schemeId;
    private final Instant occurredAt;

    protected SchemeEvent(String schemeId, Instant occurredAt) {
        this.schemeId = schemeId;
        this.occurredAt = occurredAt;
    }
}

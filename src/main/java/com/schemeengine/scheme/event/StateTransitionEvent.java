package com.schemeengine.scheme.event;

import com.schemeengine.scheme.SchemeState;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString(callSuper = true)
public class StateTransitionEvent extends SchemeEvent {

    private final SchemeState from;
    private final SchemeState to;

    public StateTransitionEvent(String schemeId, SchemeState from, SchemeState to, Instant occurredAt) {
        super(schemeId, occurredAt);
        this.from = from;
        this.to = to;
    }
}

package com.schemeengine.scheme;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchemeStateTest {

    @Test
    void testForwardEdges() {
        assertTrue(SchemeState.OFFERING.canTransitionTo(SchemeState.ORDERING));
        assertTrue(SchemeState.ORDERING.canTransitionTo(SchemeState.ASSET_HOLDING));
        assertTrue(SchemeState.ASSET_HOLDING.canTransitionTo(SchemeState.ASSET_SELLING));
        assertTrue(SchemeState.ASSET_SELLING.canTransitionTo(SchemeState.ASSET_SOLD));
        assertTrue(SchemeState.ASSET_SOLD.canTransitionTo(SchemeState.CLOSED));
    }

    @Test
    void testEarlyExitOnlyBeforePurchase() {
        assertTrue(SchemeState.OFFERING.canTransitionTo(SchemeState.CLOSED));
        assertTrue(SchemeState.ORDERING.canTransitionTo(SchemeState.CLOSED));
        assertFalse(SchemeState.ASSET_HOLDING.canTransitionTo(SchemeState.CLOSED));
        assertFalse(SchemeState.ASSET_SELLING.canTransitionTo(SchemeState.CLOSED));
    }

    @Test
    void testNoBackwardOrSkippingEdges() {
        for (SchemeState from : SchemeState.values()) {
            for (SchemeState to : SchemeState.values()) {
                if (from.canTransitionTo(to)) {
                    assertTrue(to.ordinal() > from.ordinal(), from + " -> " + to);
                }
            }
            assertFalse(from.canTransitionTo(from));
        }
        assertFalse(SchemeState.OFFERING.canTransitionTo(SchemeState.ASSET_HOLDING));
        assertTrue(SchemeState.CLOSED.successors().isEmpty());
    }
}

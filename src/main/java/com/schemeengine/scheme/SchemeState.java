package com.schemeengine.scheme;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states for a scheme.
 *
 * States only move forward. OFFERING and ORDERING may short-cut to CLOSED when the
 * position was never acquired; every other state has exactly one successor.
 */
public enum SchemeState {
    /**
     * Subscription is open. Participants deposit and withdraw contributions.
     */
    OFFERING,

    /**
     * Subscription closed and a buy order for the underlying asset is outstanding.
     */
    ORDERING,

    /**
     * The position is held. Contribution balances are now transferable shares.
     */
    ASSET_HOLDING,

    /**
     * Maturity reached and a sell order for the position is outstanding.
     */
    ASSET_SELLING,

    /**
     * The position was sold. Proceeds sit in custody awaiting redemption.
     */
    ASSET_SOLD,

    /**
     * All claims paid out. Terminal and read-only.
     */
    CLOSED;

    public Set<SchemeState> successors() {
        return switch (this) {
            case OFFERING -> EnumSet.of(ORDERING, CLOSED);
            case ORDERING -> EnumSet.of(ASSET_HOLDING, CLOSED);
            case ASSET_HOLDING -> EnumSet.of(ASSET_SELLING);
            case ASSET_SELLING -> EnumSet.of(ASSET_SOLD);
            case ASSET_SOLD -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.noneOf(SchemeState.class);
        };
    }

    public boolean canTransitionTo(SchemeState next) {
        return successors().contains(next);
    }

    /**
     * Whether the ledger currently records contributions rather than shares.
     */
    public boolean isContributionPhase() {
        return this == OFFERING || this == ORDERING;
    }
}

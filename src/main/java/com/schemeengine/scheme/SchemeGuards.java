package com.schemeengine.scheme;

import java.time.Instant;

/**
 * Precondition checks for every gated scheme operation.
 *
 * Guards only read; they never change the scheme. An operation runs its guard
 * before any ledger change or external call, and a failed guard aborts it.
 */
public final class SchemeGuards {

    private SchemeGuards() {
    }

    public static GuardResult evaluate(SchemeOperation operation, Scheme scheme, Instant now) {
        return switch (operation) {
            case DEPOSIT, WITHDRAW -> canContribute(scheme, now);
            case MAKE_BUY_ORDER -> canMakeBuyOrder(scheme, now);
            case PUBLISH_TOKEN -> canPublishToken(scheme, now);
            case SELL_ASSET -> canSellAsset(scheme, now);
            case UPDATE_SELL_ORDER -> inState(scheme, SchemeState.ASSET_SELLING);
            case SHARE_TRANSFER, SHARE_APPROVE -> canMoveShares(scheme, now);
            case REDEEM -> canRedeem(scheme, now);
        };
    }

    public static GuardResult canContribute(Scheme scheme, Instant now) {
        GuardResult state = inState(scheme, SchemeState.OFFERING);
        if (!state.isPassed()) {
            return state;
        }
        if (!scheme.getTimeline().isOfferOpen(now)) {
            return GuardResult.fail("offer closed at " + scheme.getTimeline().getOfferClosingTime());
        }
        return GuardResult.pass();
    }

    public static GuardResult canMakeBuyOrder(Scheme scheme, Instant now) {
        GuardResult state = inState(scheme, SchemeState.OFFERING);
        if (!state.isPassed()) {
            return state;
        }
        SchemeTimeline timeline = scheme.getTimeline();
        if (!timeline.isOfferClosedAt(now)) {
            return GuardResult.fail("offer is open until " + timeline.getOfferClosingTime());
        }
        return orderWindowOpen(timeline, now);
    }

    public static GuardResult canPublishToken(Scheme scheme, Instant now) {
        GuardResult state = inState(scheme, SchemeState.ORDERING);
        if (!state.isPassed()) {
            return state;
        }
        return orderWindowOpen(scheme.getTimeline(), now);
    }

    public static GuardResult canSellAsset(Scheme scheme, Instant now) {
        GuardResult state = inState(scheme, SchemeState.ASSET_HOLDING);
        if (!state.isPassed()) {
            return state;
        }
        if (!scheme.getTimeline().isMatured(now)) {
            return GuardResult.fail("position matures at " + scheme.getTimeline().getMaturity());
        }
        return GuardResult.pass();
    }

    public static GuardResult canMoveShares(Scheme scheme, Instant now) {
        GuardResult state = inState(scheme, SchemeState.ASSET_HOLDING);
        if (!state.isPassed()) {
            return state;
        }
        if (scheme.getTimeline().isMatured(now)) {
            return GuardResult.fail("shares are frozen since maturity at " + scheme.getTimeline().getMaturity());
        }
        return GuardResult.pass();
    }

    /**
     * A scheme is redeemable once the position is sold, or when it was never
     * acquired and the relevant deadline has strictly passed: the offer closing
     * time while still OFFERING, the order expiration while ORDERING.
     */
    public static GuardResult canRedeem(Scheme scheme, Instant now) {
        SchemeTimeline timeline = scheme.getTimeline();
        return switch (scheme.getState()) {
            case ASSET_SOLD -> GuardResult.pass();
            case ORDERING -> timeline.getOrderExpiration().isBefore(now)
                ? GuardResult.pass()
                : GuardResult.fail("buy order live until " + timeline.getOrderExpiration());
            case OFFERING -> timeline.getOfferClosingTime().isBefore(now)
                ? GuardResult.pass()
                : GuardResult.fail("offer open until " + timeline.getOfferClosingTime());
            case ASSET_HOLDING, ASSET_SELLING -> GuardResult.fail("position is still held");
            case CLOSED -> GuardResult.fail("scheme already closed");
        };
    }

    private static GuardResult orderWindowOpen(SchemeTimeline timeline, Instant now) {
        if (!timeline.isOrderLive(now)) {
            return GuardResult.fail("order window expired at " + timeline.getOrderExpiration());
        }
        if (timeline.isMatured(now)) {
            return GuardResult.fail("maturity reached at " + timeline.getMaturity());
        }
        return GuardResult.pass();
    }

    private static GuardResult inState(Scheme scheme, SchemeState required) {
        if (scheme.getState() != required) {
            return GuardResult.fail("requires state " + required);
        }
        return GuardResult.pass();
    }
}

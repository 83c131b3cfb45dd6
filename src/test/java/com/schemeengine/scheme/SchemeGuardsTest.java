package com.schemeengine.scheme;

import com.schemeengine.support.SchemeFixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.schemeengine.support.SchemeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the guard functions in isolation.
 */
class SchemeGuardsTest {

    private static final Map<String, Long> DEPOSITS = deposits("alice", 100, "bob", 200);

    @Test
    void testDepositWindowIsStrictlyBeforeClosing() {
        Scheme scheme = SchemeFixtures.offering(DEPOSITS);

        assertTrue(SchemeGuards.canContribute(scheme, CLOSING.minusSeconds(1)).isPassed());
        assertFalse(SchemeGuards.canContribute(scheme, CLOSING).isPassed());
    }

    @Test
    void testBuyOrderWindow() {
        Scheme scheme = SchemeFixtures.offering(DEPOSITS);

        assertFalse(SchemeGuards.canMakeBuyOrder(scheme, CLOSING.minusSeconds(1)).isPassed());
        assertTrue(SchemeGuards.canMakeBuyOrder(scheme, CLOSING).isPassed());
        assertTrue(SchemeGuards.canMakeBuyOrder(scheme, EXPIRATION.minusSeconds(1)).isPassed());
        assertFalse(SchemeGuards.canMakeBuyOrder(scheme, EXPIRATION).isPassed());
    }

    @Test
    void testPublishRequiresOrderingAndLiveOrder() {
        assertFalse(SchemeGuards.canPublishToken(SchemeFixtures.offering(DEPOSITS), CLOSING).isPassed());

        Scheme ordering = SchemeFixtures.ordering(DEPOSITS);
        assertTrue(SchemeGuards.canPublishToken(ordering, EXPIRATION.minusSeconds(1)).isPassed());
        assertFalse(SchemeGuards.canPublishToken(ordering, EXPIRATION).isPassed());
    }

    @Test
    void testSellRequiresMaturity() {
        Scheme holding = SchemeFixtures.holding(DEPOSITS, 300);

        assertFalse(SchemeGuards.canSellAsset(holding, MATURITY.minusSeconds(1)).isPassed());
        assertTrue(SchemeGuards.canSellAsset(holding, MATURITY).isPassed());
    }

    @Test
    void testSharesMoveOnlyWhileHeldBeforeMaturity() {
        assertFalse(SchemeGuards.canMoveShares(SchemeFixtures.ordering(DEPOSITS), CLOSING).isPassed());

        Scheme holding = SchemeFixtures.holding(DEPOSITS, 300);
        assertTrue(SchemeGuards.canMoveShares(holding, MATURITY.minusSeconds(1)).isPassed());
        assertFalse(SchemeGuards.canMoveShares(holding, MATURITY).isPassed());
    }

    @Test
    void testOfferingRedeemableOnlyAfterClosingTime() {
        Scheme scheme = SchemeFixtures.offering(DEPOSITS);

        assertFalse(SchemeGuards.canRedeem(scheme, CLOSING).isPassed());
        assertTrue(SchemeGuards.canRedeem(scheme, CLOSING.plusSeconds(1)).isPassed());
    }

    @Test
    void testOrderingRedeemableOnlyAfterExpiration() {
        Scheme scheme = SchemeFixtures.ordering(DEPOSITS);

        assertFalse(SchemeGuards.canRedeem(scheme, EXPIRATION).isPassed());
        assertTrue(SchemeGuards.canRedeem(scheme, EXPIRATION.plusSeconds(1)).isPassed());
    }

    @Test
    void testHeldPositionIsNeverRedeemable() {
        Scheme holding = SchemeFixtures.holding(DEPOSITS, 300);
        assertFalse(SchemeGuards.canRedeem(holding, MATURITY.plusSeconds(86_400)).isPassed());

        holding.markSellOrderPlaced(MATURITY);
        assertFalse(SchemeGuards.canRedeem(holding, MATURITY.plusSeconds(86_400)).isPassed());
    }

    @Test
    void testSoldSchemeRedeemableOnce() {
        Scheme sold = SchemeFixtures.sold(DEPOSITS, 300, 330);
        assertTrue(SchemeGuards.canRedeem(sold, MATURITY.plusSeconds(120)).isPassed());

        sold.markClosed(MATURITY.plusSeconds(120));
        GuardResult closed = SchemeGuards.canRedeem(sold, MATURITY.plusSeconds(180));
        assertFalse(closed.isPassed());
        assertEquals("scheme already closed", closed.getReason());
    }
}

package com.schemeengine.support;

import com.schemeengine.scheme.Scheme;
import com.schemeengine.scheme.SchemeTimeline;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds schemes in a given lifecycle state without going through the service.
 *
 * Timeline: offer closes at {@link #CLOSING}, the order window ends at
 * {@link #EXPIRATION}, the position matures at {@link #MATURITY}.
 */
public final class SchemeFixtures {

    public static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    public static final Instant CLOSING = START.plus(Duration.ofDays(10));
    public static final Instant EXPIRATION = CLOSING.plus(Duration.ofDays(10));
    public static final Instant MATURITY = CLOSING.plus(Duration.ofDays(60));

    private SchemeFixtures() {
    }

    /**
     * Ordered participant to amount map from alternating name/amount arguments.
     */
    public static Map<String, Long> deposits(Object... nameAmountPairs) {
        Map<String, Long> deposits = new LinkedHashMap<>();
        for (int i = 0; i < nameAmountPairs.length; i += 2) {
            deposits.put((String) nameAmountPairs[i], ((Number) nameAmountPairs[i + 1]).longValue());
        }
        return deposits;
    }

    public static SchemeTimeline timeline() {
        return SchemeTimeline.of(CLOSING, EXPIRATION, MATURITY, Duration.ofDays(90), Duration.ofDays(180));
    }

    public static Scheme offering(Map<String, Long> deposits) {
        Scheme scheme = new Scheme("BLDG-42", timeline(), START);
        deposits.forEach((participant, amount) ->
            scheme.recordDeposit(participant, BigInteger.valueOf(amount), START));
        return scheme;
    }

    public static Scheme ordering(Map<String, Long> deposits) {
        Scheme scheme = offering(deposits);
        scheme.markBuyOrderPlaced(CLOSING);
        return scheme;
    }

    public static Scheme holding(Map<String, Long> deposits, long purchasePrice) {
        Scheme scheme = ordering(deposits);
        scheme.markPurchased(BigInteger.valueOf(purchasePrice), CLOSING.plusSeconds(60));
        return scheme;
    }

    public static Scheme sold(Map<String, Long> deposits, long purchasePrice, long soldPrice) {
        Scheme scheme = holding(deposits, purchasePrice);
        scheme.markSellOrderPlaced(MATURITY);
        scheme.markSold(BigInteger.valueOf(soldPrice), MATURITY.plusSeconds(60));
        return scheme;
    }
}

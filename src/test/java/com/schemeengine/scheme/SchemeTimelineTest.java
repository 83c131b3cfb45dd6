package com.schemeengine.scheme;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SchemeTimelineTest {

    private static final Duration ORDER_WINDOW = Duration.ofDays(90);
    private static final Duration MATURITY_WINDOW = Duration.ofDays(180);
    private static final Instant CLOSING = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void testAcceptsBoundaryValues() {
        SchemeTimeline timeline = SchemeTimeline.of(CLOSING, CLOSING.plus(ORDER_WINDOW),
            CLOSING.plus(MATURITY_WINDOW), ORDER_WINDOW, MATURITY_WINDOW);

        assertEquals(CLOSING, timeline.getOfferClosingTime());

        assertDoesNotThrow(() -> SchemeTimeline.of(CLOSING, CLOSING, CLOSING, ORDER_WINDOW, MATURITY_WINDOW));
    }

    @Test
    void testRejectsOrderExpirationOutsideWindow() {
        assertThrows(IllegalArgumentException.class, () -> SchemeTimeline.of(
            CLOSING, CLOSING.minusSeconds(1), CLOSING.plus(Duration.ofDays(30)), ORDER_WINDOW, MATURITY_WINDOW));
        assertThrows(IllegalArgumentException.class, () -> SchemeTimeline.of(
            CLOSING, CLOSING.plus(ORDER_WINDOW).plusSeconds(1), CLOSING.plus(Duration.ofDays(30)),
            ORDER_WINDOW, MATURITY_WINDOW));
    }

    @Test
    void testRejectsMaturityOutsideWindow() {
        assertThrows(IllegalArgumentException.class, () -> SchemeTimeline.of(
            CLOSING, CLOSING.plus(Duration.ofDays(10)), CLOSING.minusSeconds(1), ORDER_WINDOW, MATURITY_WINDOW));
        assertThrows(IllegalArgumentException.class, () -> SchemeTimeline.of(
            CLOSING, CLOSING.plus(Duration.ofDays(10)), CLOSING.plus(MATURITY_WINDOW).plusSeconds(1),
            ORDER_WINDOW, MATURITY_WINDOW));
    }

    @Test
    void testRejectsMissingTimestamps() {
        assertThrows(IllegalArgumentException.class,
            () -> SchemeTimeline.of(null, CLOSING, CLOSING, ORDER_WINDOW, MATURITY_WINDOW));
    }
}

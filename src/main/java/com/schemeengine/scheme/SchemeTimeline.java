package com.schemeengine.scheme;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * The three deadlines that drive a scheme, fixed at construction.
 *
 * offerClosingTime <= orderExpiration <= offerClosingTime + maxOrderWindow
 * offerClosingTime <= maturity <= offerClosingTime + maxMaturityWindow
 */
@Embeddable
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SchemeTimeline {

    @Column(name = "offer_closing_time", nullable = false)
    private Instant offerClosingTime;

    @Column(name = "order_expiration", nullable = false)
    private Instant orderExpiration;

    @Column(name = "maturity", nullable = false)
    private Instant maturity;

    private SchemeTimeline(Instant offerClosingTime, Instant orderExpiration, Instant maturity) {
        this.offerClosingTime = offerClosingTime;
        this.orderExpiration = orderExpiration;
        this.maturity = maturity;
    }

    public static SchemeTimeline of(Instant offerClosingTime, Instant orderExpiration, Instant maturity,
                                    Duration maxOrderWindow, Duration maxMaturityWindow) {
        if (offerClosingTime == null || orderExpiration == null || maturity == null) {
            throw new IllegalArgumentException("Offer closing time, order expiration and maturity are required");
        }
        if (orderExpiration.isBefore(offerClosingTime)
                || orderExpiration.isAfter(offerClosingTime.plus(maxOrderWindow))) {
            throw new IllegalArgumentException(String.format(
                "Order expiration %s must be within %s after offer closing time %s",
                orderExpiration, maxOrderWindow, offerClosingTime));
        }
        if (maturity.isBefore(offerClosingTime)
                || maturity.isAfter(offerClosingTime.plus(maxMaturityWindow))) {
            throw new IllegalArgumentException(String.format(
                "Maturity %s must be within %s after offer closing time %s",
                maturity, maxMaturityWindow, offerClosingTime));
        }
        return new SchemeTimeline(offerClosingTime, orderExpiration, maturity);
    }

    public boolean isOfferOpen(Instant now) {
        return now.isBefore(offerClosingTime);
    }

    public boolean isOfferClosedAt(Instant now) {
        return !now.isBefore(offerClosingTime);
    }

    public boolean isOrderLive(Instant now) {
        return now.isBefore(orderExpiration);
    }

    public boolean isMatured(Instant now) {
        return !now.isBefore(maturity);
    }
}

package com.schemeengine.refund;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Summary of a redemption: every payout in the order it was made, plus the
 * rounding remainder and who received it.
 */
@Value
@Builder
public class RedemptionReport {

    String schemeId;

    RedemptionMode mode;

    @Singular
    List<Payout> payouts;

    @Builder.Default
    BigInteger totalPaid = BigInteger.ZERO;

    /**
     * Custody left after the pro-rata pass and swept to the largest holder.
     * Always zero for pre-purchase refunds.
     */
    @Builder.Default
    BigInteger dust = BigInteger.ZERO;

    String dustRecipient;

    public Optional<Payout> payoutFor(String participant) {
        return payouts.stream()
            .filter(payout -> payout.getParticipant().equals(participant))
            .findFirst();
    }

    public static RedemptionReport empty(String schemeId, RedemptionMode mode) {
        return RedemptionReport.builder()
            .schemeId(schemeId)
            .mode(mode)
            .build();
    }
}

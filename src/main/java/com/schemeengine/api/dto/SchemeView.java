package com.schemeengine.api.dto;

import com.schemeengine.scheme.Scheme;
import com.schemeengine.scheme.SchemeState;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read model of a scheme returned by the REST API.
 */
@Value
@Builder
public class SchemeView {

    String schemeId;
    SchemeState state;
    String underlyingAssetRef;
    Instant offerClosingTime;
    Instant orderExpiration;
    Instant maturity;
    BigInteger purchasePrice;
    BigInteger soldPrice;
    BigInteger depositTotal;
    BigInteger totalSupply;
    BigInteger custodyBalance;

    public static SchemeView of(Scheme scheme, BigInteger custodyBalance) {
        return SchemeView.builder()
            .schemeId(scheme.getSchemeId())
            .state(scheme.getState())
            .underlyingAssetRef(scheme.getUnderlyingAssetRef())
            .offerClosingTime(scheme.getTimeline().getOfferClosingTime())
            .orderExpiration(scheme.getTimeline().getOrderExpiration())
            .maturity(scheme.getTimeline().getMaturity())
            .purchasePrice(scheme.getPurchasePrice())
            .soldPrice(scheme.getSoldPrice())
            .depositTotal(scheme.depositTotal())
            .totalSupply(scheme.totalSupply())
            .custodyBalance(custodyBalance)
            .build();
    }
}

package com.schemeengine.order;

import com.schemeengine.scheme.SchemeState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Response to publishToken and updateSellOrder.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderOutcome {

    private String schemeId;
    private OrderStatus status;
    private SchemeState state;
    private BigInteger price;
    private String reason;

    public static OrderOutcome filled(String schemeId, SchemeState state, BigInteger price) {
        return OrderOutcome.builder()
            .schemeId(schemeId)
            .status(OrderStatus.FILLED)
            .state(state)
            .price(price)
            .build();
    }

    public static OrderOutcome notFilled(String schemeId, SchemeState state, String reason) {
        return OrderOutcome.builder()
            .schemeId(schemeId)
            .status(OrderStatus.NOT_FILLED)
            .state(state)
            .reason(reason)
            .build();
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }
}

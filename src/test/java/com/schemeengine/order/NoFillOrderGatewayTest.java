package com.schemeengine.order;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class NoFillOrderGatewayTest {

    private final NoFillOrderGateway gateway = new NoFillOrderGateway();

    private final OrderTicket ticket = OrderTicket.builder()
        .schemeId("s-1")
        .underlyingAssetRef("BLDG-42")
        .side(OrderSide.BUY)
        .amount(BigInteger.valueOf(1000))
        .build();

    @Test
    void testOrdersNeverFill() {
        gateway.placeBuy(ticket);
        gateway.placeSell(ticket);

        assertFalse(gateway.checkBuyFilled(ticket).isFilled());
        assertFalse(gateway.checkSellFilled(ticket).isFilled());
        assertEquals(BigInteger.ZERO, gateway.checkBuyFilled(ticket).getPrice());
    }

    @Test
    void testFillPriceMustBeNonNegative() {
        assertThrows(IllegalArgumentException.class, () -> FillReport.filled(BigInteger.valueOf(-1)));
        assertTrue(FillReport.filled(BigInteger.ZERO).isFilled());
    }
}

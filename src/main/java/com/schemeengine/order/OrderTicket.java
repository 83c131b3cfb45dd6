package com.schemeengine.order;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Identifies an order a scheme placed or is about to place.
 */
@Value
@Builder
public class OrderTicket {

    String schemeId;

    /**
     * Opaque reference to the underlying asset being bought or sold.
     */
    String underlyingAssetRef;

    OrderSide side;

    /**
     * For buys, the settlement amount committed to the purchase.
     * For sells, the size of the held position.
     */
    BigInteger amount;
}

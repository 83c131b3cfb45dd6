package com.schemeengine.scheme;

/**
 * Gated operations on a scheme. Each maps to one guard in {@link SchemeGuards}.
 */
public enum SchemeOperation {
    DEPOSIT("deposit"),
    WITHDRAW("withdraw"),
    MAKE_BUY_ORDER("makeBuyOrder"),
    PUBLISH_TOKEN("publishToken"),
    SELL_ASSET("sellAsset"),
    UPDATE_SELL_ORDER("updateSellOrder"),
    SHARE_TRANSFER("transfer"),
    SHARE_APPROVE("approve"),
    REDEEM("redeem");

    private final String operationName;

    SchemeOperation(String operationName) {
        this.operationName = operationName;
    }

    public String getOperationName() {
        return operationName;
    }
}

package com.schemeengine.order;

/**
 * Strategy for placing, cancelling and polling the orders that acquire and later
 * liquidate a scheme's underlying position.
 *
 * Matching against a real market is outside the engine. Implementations translate
 * the engine's {@link OrderTicket} into whatever the venue understands.
 *
 * A fill check that reports "not filled" is a normal business outcome, never an
 * error: the engine leaves the scheme untouched and the caller may retry later.
 * Exceptions thrown from these methods are treated as system faults and abort the
 * containing operation.
 */
public interface OrderGateway {

    void placeBuy(OrderTicket ticket);

    void cancelBuy(OrderTicket ticket);

    /**
     * Poll the buy order. On a fill the price is the settlement amount the scheme
     * owes the gateway's settlement account.
     */
    FillReport checkBuyFilled(OrderTicket ticket);

    void placeSell(OrderTicket ticket);

    void cancelSell(OrderTicket ticket);

    /**
     * Poll the sell order. On a fill the price is the amount of proceeds the venue
     * has credited to the scheme's custody account.
     */
    FillReport checkSellFilled(OrderTicket ticket);

    /**
     * Settlement asset holder that receives purchase payments.
     */
    String getSettlementAccount();

    /**
     * Get the gateway name.
     */
    String getGatewayName();
}

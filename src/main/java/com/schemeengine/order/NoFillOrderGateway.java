package com.schemeengine.order;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Order gateway that accepts every order and never reports a fill.
 *
 * This is the default until a real venue integration is plugged in. Schemes
 * running against it can still be cancelled and refunded once their order
 * window expires.
 */
@Component
@Slf4j
public class NoFillOrderGateway implements OrderGateway {

    @Override
    public void placeBuy(OrderTicket ticket) {
        log.info("NoFillOrderGateway: buy placed for scheme {} on {} amount {}",
            ticket.getSchemeId(), ticket.getUnderlyingAssetRef(), ticket.getAmount());
    }

    @Override
    public void cancelBuy(OrderTicket ticket) {
        log.info("NoFillOrderGateway: buy cancelled for scheme {}", ticket.getSchemeId());
    }

    @Override
    public FillReport checkBuyFilled(OrderTicket ticket) {
        return FillReport.notFilled();
    }

    @Override
    public void placeSell(OrderTicket ticket) {
        log.info("NoFillOrderGateway: sell placed for scheme {} on {} size {}",
            ticket.getSchemeId(), ticket.getUnderlyingAssetRef(), ticket.getAmount());
    }

    @Override
    public void cancelSell(OrderTicket ticket) {
        log.info("NoFillOrderGateway: sell cancelled for scheme {}", ticket.getSchemeId());
    }

    @Override
    public FillReport checkSellFilled(OrderTicket ticket) {
        return FillReport.notFilled();
    }

    @Override
    public String getSettlementAccount() {
        return "gateway:no-fill";
    }

    @Override
    public String getGatewayName() {
        return "NoFill";
    }
}

package com.schemeengine.asset;

import com.schemeengine.common.exception.SchemeEngineException;
import com.schemeengine.common.exception.SettlementTransferException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Moves settlement funds into and out of scheme custody.
 *
 * Translates a refused or failed transfer into {@link SettlementTransferException}
 * so the containing operation aborts instead of continuing on a partial payout.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustodyTransfers {

    private final SettlementAsset settlementAsset;

    /**
     * Pull a participant's funds into custody.
     */
    public void pull(String participant, String custodyAccount, BigInteger amount) {
        boolean moved;
        try {
            moved = settlementAsset.transferFrom(participant, custodyAccount, amount);
        } catch (SchemeEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SettlementTransferException(
                "Settlement asset failed pulling " + amount + " from " + participant,
                participant, custodyAccount, e);
        }
        if (!moved) {
            throw new SettlementTransferException(participant, custodyAccount, amount);
        }
        log.debug("Pulled {} from {} into {}", amount, participant, custodyAccount);
    }

    /**
     * Pay out of custody.
     */
    public void push(String custodyAccount, String destination, BigInteger amount) {
        boolean moved;
        try {
            moved = settlementAsset.transfer(custodyAccount, destination, amount);
        } catch (SchemeEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SettlementTransferException(
                "Settlement asset failed paying " + amount + " to " + destination,
                custodyAccount, destination, e);
        }
        if (!moved) {
            throw new SettlementTransferException(custodyAccount, destination, amount);
        }
        log.debug("Paid {} from {} to {}", amount, custodyAccount, destination);
    }

    public BigInteger balanceOf(String holder) {
        return settlementAsset.balanceOf(holder);
    }
}

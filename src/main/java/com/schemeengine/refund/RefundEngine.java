package com.schemeengine.refund;

import com.schemeengine.asset.CustodyTransfers;
import com.schemeengine.common.exception.CustodyShortfallException;
import com.schemeengine.ledger.ShareLedger;
import com.schemeengine.scheme.Scheme;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pays out every claim on a scheme and zeroes its ledger.
 *
 * Two algorithms, chosen by how far the scheme got:
 * 1. Pre-purchase: each contribution is returned 1:1.
 * 2. Post-sale: proceeds are split pro-rata by share balance, rounding down, and
 *    whatever is left in custody goes to the largest holder.
 *
 * Both plan every payout and check custody before the first burn or transfer.
 * Each participant's balance is burned before they are paid. The engine does not
 * change the scheme's state; the caller closes it after a successful run and is
 * responsible for the redeem guard.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefundEngine {

    private final CustodyTransfers custodyTransfers;

    public RedemptionReport refundContributions(Scheme scheme) {
        ShareLedger ledger = scheme.ledger();
        String custody = scheme.getCustodyAccount();
        BigInteger totalSupply = ledger.getTotalSupply();

        if (totalSupply.signum() == 0) {
            log.info("Scheme {} has no contributions to refund", scheme.getSchemeId());
            return RedemptionReport.empty(scheme.getSchemeId(), RedemptionMode.PRE_PURCHASE);
        }

        BigInteger custodyBalance = custodyTransfers.balanceOf(custody);
        if (custodyBalance.compareTo(totalSupply) < 0) {
            throw new CustodyShortfallException(scheme.getSchemeId(), totalSupply, custodyBalance);
        }

        Map<String, BigInteger> balances = nonzeroBalances(ledger);
        log.info("Refunding {} contributions totalling {} for scheme {}",
            balances.size(), totalSupply, scheme.getSchemeId());

        RedemptionReport.RedemptionReportBuilder report = RedemptionReport.builder()
            .schemeId(scheme.getSchemeId())
            .mode(RedemptionMode.PRE_PURCHASE);

        BigInteger totalPaid = BigInteger.ZERO;
        for (Map.Entry<String, BigInteger> entry : balances.entrySet()) {
            String participant = entry.getKey();
            BigInteger balance = entry.getValue();

            ledger.burn(participant, balance);
            custodyTransfers.push(custody, participant, balance);

            report.payout(new Payout(participant, balance, balance));
            totalPaid = totalPaid.add(balance);
        }

        return report.totalPaid(totalPaid).build();
    }

    public RedemptionReport distributeProceeds(Scheme scheme) {
        ShareLedger ledger = scheme.ledger();
        String custody = scheme.getCustodyAccount();
        BigInteger soldPrice = scheme.getSoldPrice();
        BigInteger totalSupply = ledger.getTotalSupply();

        if (soldPrice.signum() == 0 || ledger.getParticipants().isEmpty() || totalSupply.signum() == 0) {
            log.info("Scheme {} has nothing to distribute (soldPrice={}, totalSupply={})",
                scheme.getSchemeId(), soldPrice, totalSupply);
            return RedemptionReport.empty(scheme.getSchemeId(), RedemptionMode.POST_SALE);
        }

        BigInteger custodyBalance = custodyTransfers.balanceOf(custody);
        if (custodyBalance.compareTo(soldPrice) < 0) {
            throw new CustodyShortfallException(scheme.getSchemeId(), soldPrice, custodyBalance);
        }

        // Plan: floor shares against the supply at entry, and the first strictly largest holder.
        Map<String, BigInteger> balances = nonzeroBalances(ledger);
        Map<String, BigInteger> shares = new LinkedHashMap<>();
        String largestHolder = null;
        BigInteger largestBalance = BigInteger.ZERO;
        for (Map.Entry<String, BigInteger> entry : balances.entrySet()) {
            BigInteger balance = entry.getValue();
            shares.put(entry.getKey(), soldPrice.multiply(balance).divide(totalSupply));
            if (balance.compareTo(largestBalance) > 0) {
                largestHolder = entry.getKey();
                largestBalance = balance;
            }
        }

        log.info("Distributing {} to {} holders of scheme {} (supply {})",
            soldPrice, shares.size(), scheme.getSchemeId(), totalSupply);

        BigInteger totalPaid = BigInteger.ZERO;
        for (Map.Entry<String, BigInteger> entry : shares.entrySet()) {
            String participant = entry.getKey();
            BigInteger share = entry.getValue();

            ledger.burn(participant, balances.get(participant));
            if (share.signum() > 0) {
                custodyTransfers.push(custody, participant, share);
            }
            totalPaid = totalPaid.add(share);
        }

        BigInteger dust = custodyTransfers.balanceOf(custody);
        if (dust.signum() > 0) {
            custodyTransfers.push(custody, largestHolder, dust);
            totalPaid = totalPaid.add(dust);
            log.info("Swept {} of rounding remainder to {} for scheme {}", dust, largestHolder, scheme.getSchemeId());
        }

        List<Payout> payouts = new ArrayList<>();
        for (Map.Entry<String, BigInteger> entry : shares.entrySet()) {
            String participant = entry.getKey();
            BigInteger paid = participant.equals(largestHolder) ? entry.getValue().add(dust) : entry.getValue();
            payouts.add(new Payout(participant, balances.get(participant), paid));
        }

        return RedemptionReport.builder()
            .schemeId(scheme.getSchemeId())
            .mode(RedemptionMode.POST_SALE)
            .payouts(payouts)
            .totalPaid(totalPaid)
            .dust(dust)
            .dustRecipient(dust.signum() > 0 ? largestHolder : null)
            .build();
    }

    private static Map<String, BigInteger> nonzeroBalances(ShareLedger ledger) {
        Map<String, BigInteger> balances = new LinkedHashMap<>();
        for (String participant : ledger.getParticipants()) {
            BigInteger balance = ledger.balanceOf(participant);
            if (balance.signum() > 0) {
                balances.put(participant, balance);
            }
        }
        return balances;
    }
}

package com.schemeengine.scheme;

import com.schemeengine.asset.CustodyTransfers;
import com.schemeengine.common.exception.CustodyShortfallException;
import com.schemeengine.common.exception.InvalidTransferException;
import com.schemeengine.common.exception.SchemeNotFoundException;
import com.schemeengine.order.FillReport;
import com.schemeengine.order.OrderGateway;
import com.schemeengine.order.OrderOutcome;
import com.schemeengine.order.OrderSide;
import com.schemeengine.order.OrderTicket;
import com.schemeengine.refund.RedemptionReport;
import com.schemeengine.refund.RefundEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for every scheme operation.
 *
 * Each mutating method runs in one transaction with the scheme row locked:
 * 1. Evaluate the operation's guard
 * 2. Call out to the settlement asset or order gateway
 * 3. Update the ledger and state
 * 4. Publish the recorded events (delivered after commit)
 *
 * Any exception rolls back ledger, state and settlement asset changes together.
 * An order that has not filled is reported through {@link OrderOutcome}, not an
 * exception, and leaves the scheme untouched.
 */
@Service
@Slf4j
public class SchemeService {

    private final SchemeRepository schemeRepository;
    private final CustodyTransfers custodyTransfers;
    private final OrderGateway orderGateway;
    private final RefundEngine refundEngine;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration maxOrderWindow;
    private final Duration maxMaturityWindow;

    public SchemeService(SchemeRepository schemeRepository,
                         CustodyTransfers custodyTransfers,
                         OrderGateway orderGateway,
                         RefundEngine refundEngine,
                         ApplicationEventPublisher eventPublisher,
                         Clock clock,
                         @Value("${scheme-engine.timeline.max-order-window:90d}") Duration maxOrderWindow,
                         @Value("${scheme-engine.timeline.max-maturity-window:180d}") Duration maxMaturityWindow) {
        this.schemeRepository = schemeRepository;
        this.custodyTransfers = custodyTransfers;
        this.orderGateway = orderGateway;
        this.refundEngine = refundEngine;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxOrderWindow = maxOrderWindow;
        this.maxMaturityWindow = maxMaturityWindow;
    }

    @Transactional
    public Scheme createScheme(String underlyingAssetRef, Instant offerClosingTime,
                               Instant orderExpiration, Instant maturity) {
        if (underlyingAssetRef == null || underlyingAssetRef.isBlank()) {
            throw new IllegalArgumentException("Underlying asset reference is required");
        }
        SchemeTimeline timeline = SchemeTimeline.of(offerClosingTime, orderExpiration, maturity,
            maxOrderWindow, maxMaturityWindow);

        Scheme scheme = new Scheme(underlyingAssetRef, timeline, clock.instant());
        schemeRepository.save(scheme);

        log.info("Created scheme {} on {} closing {} expiring {} maturing {}",
            scheme.getSchemeId(), underlyingAssetRef, offerClosingTime, orderExpiration, maturity);
        return scheme;
    }

    @Transactional(readOnly = true)
    public Scheme getScheme(String schemeId) {
        return schemeRepository.findBySchemeId(schemeId)
            .orElseThrow(() -> new SchemeNotFoundException(schemeId));
    }

    @Transactional(readOnly = true)
    public SchemeState getState(String schemeId) {
        return getScheme(schemeId).getState();
    }

    @Transactional(readOnly = true)
    public List<Scheme> getSchemesByState(SchemeState state) {
        return schemeRepository.findByState(state);
    }

    // Contributions

    @Transactional
    public void deposit(String schemeId, String participant, BigInteger amount) {
        requirePositive(amount);
        Scheme scheme = lockScheme(schemeId);
        Instant now = clock.instant();
        scheme.require(SchemeOperation.DEPOSIT, now);
        requireNotCustody(scheme, participant);

        custodyTransfers.pull(participant, scheme.getCustodyAccount(), amount);
        scheme.recordDeposit(participant, amount, now);
        finish(scheme);

        log.info("Deposited {} from {} into scheme {}", amount, participant, schemeId);
    }

    @Transactional
    public void withdraw(String schemeId, String participant, BigInteger amount) {
        requirePositive(amount);
        Scheme scheme = lockScheme(schemeId);
        Instant now = clock.instant();
        requireNotCustody(scheme, participant);

        scheme.recordWithdrawal(participant, amount, now);
        custodyTransfers.push(scheme.getCustodyAccount(), participant, amount);
        finish(scheme);

        log.info("Withdrew {} from scheme {} to {}", amount, schemeId, participant);
    }

    /**
     * Withdraw the participant's entire contribution.
     *
     * @return the amount withdrawn
     */
    @Transactional
    public BigInteger withdraw(String schemeId, String participant) {
        Scheme scheme = lockScheme(schemeId);
        Instant now = clock.instant();
        scheme.require(SchemeOperation.WITHDRAW, now);
        requireNotCustody(scheme, participant);

        BigInteger balance = scheme.depositOf(participant);
        if (balance.signum() == 0) {
            throw new IllegalArgumentException("Nothing to withdraw for " + participant);
        }

        scheme.recordWithdrawal(participant, balance, now);
        custodyTransfers.push(scheme.getCustodyAccount(), participant, balance);
        finish(scheme);

        log.info("Withdrew full contribution {} from scheme {} to {}", balance, schemeId, participant);
        return balance;
    }

    @Transactional(readOnly = true)
    public BigInteger depositTotal(String schemeId) {
        return getScheme(schemeId).depositTotal();
    }

    @Transactional(readOnly = true)
    public BigInteger depositOf(String schemeId, String participant) {
        return getScheme(schemeId).depositOf(participant);
    }

    // Orders

    @Transactional
    public void makeBuyOrder(String schemeId) {
        Scheme scheme = lockScheme(schemeId);
        Instant now = clock.instant();
        scheme.require(SchemeOperation.MAKE_BUY_ORDER, now);

        OrderTicket ticket = ticket(scheme, OrderSide.BUY);
        orderGateway.placeBuy(ticket);
        scheme.markBuyOrderPlaced(now);
        finish(scheme);

        log.info("Placed buy order for scheme {} via {} amount {}",
            schemeId, orderGateway.getGatewayName(), ticket.getAmount());
    }

    /**
     * Try to complete the purchase. On a fill the purchase price is paid out of
     * custody and contributions become shares.
     */
    @Transactional
    public OrderOutcome publishToken(String schemeId) {
        Scheme scheme = lockScheme(schemeId);
        Instant now = clock.instant();
        scheme.require(SchemeOperation.PUBLISH_TOKEN, now);

        FillReport fill = orderGateway.checkBuyFilled(ticket(scheme, OrderSide.BUY));
        if (!fill.isFilled()) {
            log.info("Buy order for scheme {} not filled yet", schemeId);
            return OrderOutcome.notFilled(schemeId, scheme.getState(), "Buy order not filled");
        }

        BigInteger price = fill.getPrice();
        String custody = scheme.getCustodyAccount();
        BigInteger custodyBalance = custodyTransfers.balanceOf(custody);
        if (custodyBalance.compareTo(price) < 0) {
            throw new CustodyShortfallException(schemeId, price, custodyBalance);
        }
        if (price.signum() > 0) {
            custodyTransfers.push(custody, orderGateway.getSettlementAccount(), price);
        }
        scheme.markPurchased(price, now);
        finish(scheme);

        log.info("Scheme {} acquired {} for {}; {} shares issued",
            schemeId, scheme.getUnderlyingAssetRef(), price, scheme.totalSupply());
        return OrderOutcome.filled(schemeId, scheme.getState(), price);
    }

    @Transactional
    public void sellAsset(String schemeId) {
        Scheme scheme = lockScheme(schemeId);
        Instant now = clock.instant();
        scheme.require(SchemeOperation.SELL_ASSET, now);

        orderGateway.placeSell(ticket(scheme, OrderSide.SELL));
        scheme.markSellOrderPlaced(now);
        finish(scheme);

        log.info("Placed sell order for scheme {} via {}", schemeId, orderGateway.getGatewayName());
    }

    /**
     * Check the sell order. On a fill the sale proceeds are recorded; otherwise
     * the stale order is replaced with a fresh one.
     */
    @Transactional
    public OrderOutcome updateSellOrder(String schemeId) {
        Scheme scheme = lockScheme(schemeId);
        Instant now = clock.instant();
        scheme.require(SchemeOperation.UPDATE_SELL_ORDER, now);

        OrderTicket ticket = ticket(scheme, OrderSide.SELL);
        FillReport fill = orderGateway.checkSellFilled(ticket);
        if (!fill.isFilled()) {
            orderGateway.cancelSell(ticket);
            orderGateway.placeSell(ticket);
            log.info("Sell order for scheme {} not filled yet; order refreshed", schemeId);
            return OrderOutcome.notFilled(schemeId, scheme.getState(), "Sell order not filled");
        }

        scheme.markSold(fill.getPrice(), now);
        finish(scheme);

        log.info("Scheme {} sold {} for {}", schemeId, scheme.getUnderlyingAssetRef(), fill.getPrice());
        return OrderOutcome.filled(schemeId, scheme.getState(), fill.getPrice());
    }

    // Redemption

    /**
     * Pay out every claim and close the scheme.
     */
    @Transactional
    public RedemptionReport redeem(String schemeId) {
        Scheme scheme = lockScheme(schemeId);
        Instant now = clock.instant();
        scheme.require(SchemeOperation.REDEEM, now);

        SchemeState entryState = scheme.getState();
        if (entryState == SchemeState.ORDERING) {
            orderGateway.cancelBuy(ticket(scheme, OrderSide.BUY));
        }

        RedemptionReport report = entryState == SchemeState.ASSET_SOLD
            ? refundEngine.distributeProceeds(scheme)
            : refundEngine.refundContributions(scheme);

        scheme.markClosed(now);
        finish(scheme);

        log.info("Redeemed scheme {} from {}: paid {} to {} participants",
            schemeId, entryState, report.getTotalPaid(), report.getPayouts().size());
        return report;
    }

    // Shares

    @Transactional
    public void transfer(String schemeId, String from, String to, BigInteger amount) {
        Scheme scheme = lockScheme(schemeId);
        requireNotCustody(scheme, to);
        scheme.transferShares(from, to, amount, clock.instant());
        finish(scheme);
    }

    @Transactional
    public void transferFrom(String schemeId, String spender, String from, String to, BigInteger amount) {
        Scheme scheme = lockScheme(schemeId);
        requireNotCustody(scheme, to);
        scheme.transferSharesFrom(spender, from, to, amount, clock.instant());
        finish(scheme);
    }

    @Transactional
    public void approve(String schemeId, String owner, String spender, BigInteger amount) {
        Scheme scheme = lockScheme(schemeId);
        scheme.approveShares(owner, spender, amount, clock.instant());
        finish(scheme);
    }

    @Transactional(readOnly = true)
    public BigInteger totalSupply(String schemeId) {
        return getScheme(schemeId).totalSupply();
    }

    @Transactional(readOnly = true)
    public BigInteger balanceOf(String schemeId, String holder) {
        return getScheme(schemeId).balanceOf(holder);
    }

    @Transactional(readOnly = true)
    public BigInteger allowance(String schemeId, String owner, String spender) {
        return getScheme(schemeId).allowance(owner, spender);
    }

    @Transactional(readOnly = true)
    public BigInteger custodyBalance(String schemeId) {
        return custodyTransfers.balanceOf(getScheme(schemeId).getCustodyAccount());
    }

    private Scheme lockScheme(String schemeId) {
        return schemeRepository.findForUpdate(schemeId)
            .orElseThrow(() -> new SchemeNotFoundException(schemeId));
    }

    private void finish(Scheme scheme) {
        schemeRepository.save(scheme);
        scheme.drainEvents().forEach(eventPublisher::publishEvent);
    }

    private static OrderTicket ticket(Scheme scheme, OrderSide side) {
        return OrderTicket.builder()
            .schemeId(scheme.getSchemeId())
            .underlyingAssetRef(scheme.getUnderlyingAssetRef())
            .side(side)
            .amount(scheme.ledger().getTotalSupply())
            .build();
    }

    /**
     * A scheme's custody account never holds a claim on that scheme.
     */
    private static void requireNotCustody(Scheme scheme, String holder) {
        if (scheme.getCustodyAccount().equals(holder)) {
            throw new InvalidTransferException(
                "Custody account " + holder + " cannot hold a claim on its own scheme");
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}

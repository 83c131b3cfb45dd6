package com.schemeengine.scheme;

import com.schemeengine.common.exception.InvalidSchemeStateException;
import com.schemeengine.ledger.ShareLedger;
import com.schemeengine.scheme.event.ApprovalEvent;
import com.schemeengine.scheme.event.SchemeEvent;
import com.schemeengine.scheme.event.StateTransitionEvent;
import com.schemeengine.scheme.event.TransferEvent;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A pooled investment scheme: one underlying position funded by many participants.
 *
 * The scheme owns its lifecycle state, its timeline and its ledger. Every mutating
 * method evaluates the guard for its operation first and only then touches the
 * ledger or the state, so a rejected call changes nothing. Settlement asset
 * movements are orchestrated by {@link SchemeService}; this class only does the
 * bookkeeping.
 */
@Entity
@Table(name = "schemes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Scheme {

    private static final String CUSTODY_PREFIX = "scheme:";

    @Id
    private String schemeId;

    @Version
    private Long version;

    @Enumerated(EnumType.STRING)
    private SchemeState state;

    @Embedded
    private SchemeTimeline timeline;

    /**
     * Opaque reference to the underlying asset. Immutable.
     */
    private String underlyingAssetRef;

    /**
     * Settlement amount paid for the position. Zero until the buy fills; written once.
     */
    @Column(name = "purchase_price", precision = 78, scale = 0, nullable = false)
    private BigInteger purchasePrice = BigInteger.ZERO;

    /**
     * Proceeds of the sale. Zero until the sell fills; written once.
     */
    @Column(name = "sold_price", precision = 78, scale = 0, nullable = false)
    private BigInteger soldPrice = BigInteger.ZERO;

    @Getter(AccessLevel.NONE)
    @OneToOne(cascade = CascadeType.ALL, fetch = FetchType.EAGER, orphanRemoval = true)
    @JoinColumn(name = "ledger_id", nullable = false)
    private ShareLedger ledger;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private List<SchemeEvent> pendingEvents = new ArrayList<>();

    public Scheme(String underlyingAssetRef, SchemeTimeline timeline, Instant now) {
        this.schemeId = UUID.randomUUID().toString();
        this.underlyingAssetRef = underlyingAssetRef;
        this.timeline = timeline;
        this.state = SchemeState.OFFERING;
        this.ledger = new ShareLedger(schemeId);
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Settlement asset holder that custodies this scheme's funds.
     */
    public String getCustodyAccount() {
        return CUSTODY_PREFIX + schemeId;
    }

    /**
     * Fail with {@link InvalidSchemeStateException} unless the guard for
     * {@code operation} passes at {@code now}.
     */
    public void require(SchemeOperation operation, Instant now) {
        GuardResult result = SchemeGuards.evaluate(operation, this, now);
        if (!result.isPassed()) {
            throw new InvalidSchemeStateException(schemeId, state.name(),
                operation.getOperationName(), result.getReason());
        }
    }

    // Contribution phase

    public void recordDeposit(String participant, BigInteger amount, Instant now) {
        require(SchemeOperation.DEPOSIT, now);
        ledger.mint(participant, amount);
        touch(now);
    }

    public void recordWithdrawal(String participant, BigInteger amount, Instant now) {
        require(SchemeOperation.WITHDRAW, now);
        ledger.burn(participant, amount);
        touch(now);
    }

    public BigInteger depositTotal() {
        return state.isContributionPhase() ? ledger.getTotalSupply() : BigInteger.ZERO;
    }

    public BigInteger depositOf(String participant) {
        return state.isContributionPhase() ? ledger.balanceOf(participant) : BigInteger.ZERO;
    }

    // Order lifecycle

    public void markBuyOrderPlaced(Instant now) {
        require(SchemeOperation.MAKE_BUY_ORDER, now);
        transitionTo(SchemeState.ORDERING, now);
    }

    public void markPurchased(BigInteger price, Instant now) {
        require(SchemeOperation.PUBLISH_TOKEN, now);
        if (purchasePrice.signum() != 0) {
            throw new IllegalStateException("Purchase price already recorded for scheme " + schemeId);
        }
        this.purchasePrice = price;
        transitionTo(SchemeState.ASSET_HOLDING, now);
    }

    public void markSellOrderPlaced(Instant now) {
        require(SchemeOperation.SELL_ASSET, now);
        transitionTo(SchemeState.ASSET_SELLING, now);
    }

    public void markSold(BigInteger price, Instant now) {
        require(SchemeOperation.UPDATE_SELL_ORDER, now);
        if (soldPrice.signum() != 0) {
            throw new IllegalStateException("Sold price already recorded for scheme " + schemeId);
        }
        this.soldPrice = price;
        transitionTo(SchemeState.ASSET_SOLD, now);
    }

    public void markClosed(Instant now) {
        require(SchemeOperation.REDEEM, now);
        transitionTo(SchemeState.CLOSED, now);
    }

    // Share phase

    public void transferShares(String from, String to, BigInteger amount, Instant now) {
        require(SchemeOperation.SHARE_TRANSFER, now);
        ledger.transfer(from, to, amount);
        pendingEvents.add(new TransferEvent(schemeId, from, to, amount, now));
        touch(now);
    }

    public void transferSharesFrom(String spender, String from, String to, BigInteger amount, Instant now) {
        require(SchemeOperation.SHARE_TRANSFER, now);
        ledger.transferFrom(spender, from, to, amount);
        pendingEvents.add(new TransferEvent(schemeId, from, to, amount, now));
        touch(now);
    }

    public void approveShares(String owner, String spender, BigInteger amount, Instant now) {
        require(SchemeOperation.SHARE_APPROVE, now);
        ledger.approve(owner, spender, amount);
        pendingEvents.add(new ApprovalEvent(schemeId, owner, spender, amount, now));
        touch(now);
    }

    /**
     * Share supply. Zero outside ASSET_HOLDING, when no share claims are visible.
     */
    public BigInteger totalSupply() {
        return state == SchemeState.ASSET_HOLDING ? ledger.getTotalSupply() : BigInteger.ZERO;
    }

    public BigInteger balanceOf(String holder) {
        return state == SchemeState.ASSET_HOLDING ? ledger.balanceOf(holder) : BigInteger.ZERO;
    }

    public BigInteger allowance(String owner, String spender) {
        return state == SchemeState.ASSET_HOLDING ? ledger.allowance(owner, spender) : BigInteger.ZERO;
    }

    /**
     * Raw ledger, whatever role it currently plays. The refund engine burns through
     * this after the redeem guard has passed.
     */
    public ShareLedger ledger() {
        return ledger;
    }

    /**
     * Events recorded since the last call, in order. Clears the buffer.
     */
    public List<SchemeEvent> drainEvents() {
        List<SchemeEvent> events = List.copyOf(pendingEvents);
        pendingEvents.clear();
        return events;
    }

    private void transitionTo(SchemeState next, Instant now) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Illegal transition %s -> %s for scheme %s", state, next, schemeId));
        }
        SchemeState previous = state;
        this.state = next;
        pendingEvents.add(new StateTransitionEvent(schemeId, previous, next, now));
        touch(now);
    }

    private void touch(Instant now) {
        this.updatedAt = now;
    }
}

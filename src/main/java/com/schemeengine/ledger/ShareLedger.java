package com.schemeengine.ledger;

import com.schemeengine.common.exception.InsufficientAllowanceException;
import com.schemeengine.common.exception.InsufficientBalanceException;
import com.schemeengine.common.exception.InvalidTransferException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fungible balance and allowance ledger.
 *
 * One instance backs each scheme and plays two roles over its life: while the
 * offer is open it records contributions (mint on deposit, burn on withdrawal or
 * refund); once the underlying position is acquired the same balances are the
 * share register and transfers and approvals become legal. The ledger itself is
 * role-agnostic; the owning scheme decides which operations are allowed when.
 *
 * Invariants:
 * - totalSupply equals the sum of all balances after every operation
 * - no balance is ever negative
 * - participants holds every holder that ever had a nonzero balance, once,
 *   in the order they first appeared
 *
 * Every operation checks all of its preconditions before mutating anything, so a
 * rejected call leaves the ledger exactly as it was.
 */
@Entity
@Table(name = "share_ledgers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = {"balances", "allowances", "participants"})
public class ShareLedger {

    /**
     * Allowance value that is never decremented by delegated transfers.
     */
    public static final BigInteger UNLIMITED_ALLOWANCE = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    @Id
    private String ledgerId;

    @Column(name = "total_supply", precision = 78, scale = 0, nullable = false)
    private BigInteger totalSupply = BigInteger.ZERO;

    @Getter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ledger_balances", joinColumns = @JoinColumn(name = "ledger_id"))
    @MapKeyColumn(name = "holder")
    @Column(name = "balance", precision = 78, scale = 0)
    private Map<String, BigInteger> balances = new HashMap<>();

    @Getter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ledger_allowances", joinColumns = @JoinColumn(name = "ledger_id"))
    @Column(name = "amount", precision = 78, scale = 0)
    private Map<AllowanceKey, BigInteger> allowances = new HashMap<>();

    @Getter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ledger_participants", joinColumns = @JoinColumn(name = "ledger_id"))
    @OrderColumn(name = "position")
    @Column(name = "participant")
    private List<String> participants = new ArrayList<>();

    public ShareLedger(String ledgerId) {
        this.ledgerId = ledgerId;
    }

    public BigInteger balanceOf(String holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    public BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(new AllowanceKey(owner, spender), BigInteger.ZERO);
    }

    /**
     * Holders in first-seen order. Read-only view.
     */
    public List<String> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    public void mint(String holder, BigInteger amount) {
        requireNonNegative(amount);
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("Holder is required");
        }

        credit(holder, amount);
        totalSupply = totalSupply.add(amount);
    }

    public void burn(String holder, BigInteger amount) {
        requireNonNegative(amount);
        BigInteger balance = balanceOf(holder);
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(holder, amount, balance);
        }

        balances.put(holder, balance.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
    }

    public void transfer(String from, String to, BigInteger amount) {
        requireNonNegative(amount);
        validateTransfer(from, to, amount);

        move(from, to, amount);
    }

    /**
     * Move {@code amount} from {@code from} to {@code to} on behalf of {@code spender},
     * consuming the allowance {@code from} granted to {@code spender}.
     */
    public void transferFrom(String spender, String from, String to, BigInteger amount) {
        requireNonNegative(amount);
        validateTransfer(from, to, amount);

        AllowanceKey key = new AllowanceKey(from, spender);
        BigInteger allowed = allowances.getOrDefault(key, BigInteger.ZERO);
        if (allowed.compareTo(amount) < 0) {
            throw new InsufficientAllowanceException(from, spender, amount, allowed);
        }

        if (!UNLIMITED_ALLOWANCE.equals(allowed)) {
            allowances.put(key, allowed.subtract(amount));
        }
        move(from, to, amount);
    }

    /**
     * Set (not add to) the amount {@code spender} may move out of {@code owner}'s balance.
     */
    public void approve(String owner, String spender, BigInteger amount) {
        requireNonNegative(amount);
        if (spender == null || spender.isBlank()) {
            throw new InvalidTransferException("Spender is required");
        }
        if (amount.compareTo(UNLIMITED_ALLOWANCE) > 0) {
            throw new IllegalArgumentException("Allowance exceeds the unlimited sentinel");
        }

        allowances.put(new AllowanceKey(owner, spender), amount);
    }

    /**
     * Check that totalSupply matches the sum of balances and no balance is negative.
     */
    public boolean isConsistent() {
        BigInteger sum = BigInteger.ZERO;
        for (BigInteger balance : balances.values()) {
            if (balance.signum() < 0) {
                return false;
            }
            sum = sum.add(balance);
        }
        return sum.equals(totalSupply);
    }

    private void validateTransfer(String from, String to, BigInteger amount) {
        if (to == null || to.isBlank()) {
            throw new InvalidTransferException("Transfer recipient is required");
        }
        if (to.equals(from)) {
            throw new InvalidTransferException("Cannot transfer to self: " + from);
        }
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(from, amount, balance);
        }
    }

    private void move(String from, String to, BigInteger amount) {
        balances.put(from, balanceOf(from).subtract(amount));
        credit(to, amount);
    }

    private void credit(String holder, BigInteger amount) {
        balances.put(holder, balanceOf(holder).add(amount));
        if (amount.signum() > 0 && !participants.contains(holder)) {
            participants.add(holder);
        }
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
    }
}

package com.schemeengine.asset;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Balance of one holder in the internal settlement asset.
 */
@Entity
@Table(name = "settlement_accounts")
@Data
@NoArgsConstructor
public class SettlementAccount {

    @Id
    private String holder;

    @Version
    private Long version;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger balance;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public SettlementAccount(String holder) {
        this.holder = holder;
        this.balance = BigInteger.ZERO;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public boolean canCover(BigInteger amount) {
        return balance.compareTo(amount) >= 0;
    }

    public void credit(BigInteger amount) {
        this.balance = balance.add(amount);
        this.updatedAt = Instant.now();
    }

    public void debit(BigInteger amount) {
        if (!canCover(amount)) {
            throw new IllegalStateException("Debit exceeds balance of " + holder);
        }
        this.balance = balance.subtract(amount);
        this.updatedAt = Instant.now();
    }
}

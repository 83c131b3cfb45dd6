package com.schemeengine.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * (owner, spender) pair identifying one allowance.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AllowanceKey {

    @Column(name = "owner_id")
    private String owner;

    @Column(name = "spender_id")
    private String spender;
}

package com.schemeengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for deposits and withdrawals. A withdrawal without an amount takes the
 * participant's whole contribution.
 */
@Data
public class ContributionRequest {

    @NotBlank(message = "Participant is required")
    private String participant;

    @Positive(message = "Amount must be positive")
    private BigInteger amount;
}

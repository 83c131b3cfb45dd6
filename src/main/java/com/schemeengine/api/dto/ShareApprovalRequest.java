package com.schemeengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for setting a share allowance.
 */
@Data
public class ShareApprovalRequest {

    @NotBlank(message = "Owner is required")
    private String owner;

    @NotBlank(message = "Spender is required")
    private String spender;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    private BigInteger amount;
}

package com.schemeengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for share transfers. When a spender is given the transfer draws on the
 * allowance {@code from} granted to that spender.
 */
@Data
public class ShareTransferRequest {

    private String spender;

    @NotBlank(message = "Sender is required")
    private String from;

    @NotBlank(message = "Recipient is required")
    private String to;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    private BigInteger amount;
}

package com.schemeengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;

/**
 * DTO for creating a new scheme.
 */
@Data
public class CreateSchemeRequest {

    @NotBlank(message = "Underlying asset reference is required")
    private String underlyingAssetRef;

    @NotNull(message = "Offer closing time is required")
    private Instant offerClosingTime;

    @NotNull(message = "Order expiration is required")
    private Instant orderExpiration;

    @NotNull(message = "Maturity is required")
    private Instant maturity;
}

package com.flagship.collateral_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request DTO for liquidating another account; the caller is the liquidator.
 */
@Data
@NoArgsConstructor
public class LiquidationRequest {

    @NotBlank(message = "Collateral asset is required")
    @JsonProperty("collateral_asset")
    private String collateralAsset;

    @NotBlank(message = "Target account is required")
    @JsonProperty("target_account")
    private String targetAccount;

    @NotNull(message = "Debt to cover is required")
    @JsonProperty("debt_to_cover")
    private BigInteger debtToCover;
}

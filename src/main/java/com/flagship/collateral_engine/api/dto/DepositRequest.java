package com.flagship.collateral_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request DTO for depositing collateral (and optionally minting against it).
 * {@code debtAmount} is only read by the deposit-and-mint endpoint.
 */
@Data
@NoArgsConstructor
public class DepositRequest {

    @NotBlank(message = "Asset is required")
    @JsonProperty("asset")
    private String asset;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigInteger amount;

    @JsonProperty("debt_amount")
    private BigInteger debtAmount;
}

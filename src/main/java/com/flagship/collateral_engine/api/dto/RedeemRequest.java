package com.flagship.collateral_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request DTO for redeeming collateral; {@code debtAmount} is burned first when
 * used with the redeem-for-debt endpoint.
 */
@Data
@NoArgsConstructor
public class RedeemRequest {

    @NotBlank(message = "Asset is required")
    @JsonProperty("asset")
    private String asset;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigInteger amount;

    @JsonProperty("debt_amount")
    private BigInteger debtAmount;
}

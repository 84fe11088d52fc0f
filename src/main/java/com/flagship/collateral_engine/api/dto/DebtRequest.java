package com.flagship.collateral_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
public class DebtRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigInteger amount;
}

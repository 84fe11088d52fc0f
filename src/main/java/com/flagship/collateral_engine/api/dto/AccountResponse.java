package com.flagship.collateral_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Response DTO describing one account's position.
 * Valuation fields are left out when the position could not be priced.
 */
@Value
@Builder
public class AccountResponse {

    @JsonProperty("account")
    String account;

    @JsonProperty("debt")
    BigInteger debt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("collateral_value_usd")
    BigInteger collateralValueUsd;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("health_factor")
    BigInteger healthFactor;

    @JsonProperty("collateral")
    Map<String, BigInteger> collateral;
}

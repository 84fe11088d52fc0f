package com.flagship.collateral_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

/**
 * Normalized (18-decimal) USD price of one collateral unit.
 */
@Value
public class PriceResponse {

    @JsonProperty("asset")
    String asset;

    @JsonProperty("price")
    BigInteger price;
}

package com.flagship.collateral_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Every tunable constant, so clients can simulate operations before sending them.
 */
@Value
@Builder
public class ParametersResponse {

    @JsonProperty("debt_token")
    String debtToken;

    @JsonProperty("liquidation_threshold_pct")
    int liquidationThresholdPct;

    @JsonProperty("liquidation_bonus_pct")
    int liquidationBonusPct;

    @JsonProperty("liquidation_precision")
    BigInteger liquidationPrecision;

    @JsonProperty("precision")
    BigInteger precision;

    @JsonProperty("additional_feed_precision")
    BigInteger additionalFeedPrecision;

    @JsonProperty("min_health_factor")
    BigInteger minHealthFactor;
}

package com.flagship.collateral_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collateral_engine.engine.LiquidationResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class LiquidationResponse {

    @JsonProperty("target_account")
    String targetAccount;

    @JsonProperty("collateral_asset")
    String collateralAsset;

    @JsonProperty("debt_covered")
    BigInteger debtCovered;

    @JsonProperty("collateral_seized")
    BigInteger collateralSeized;

    @JsonProperty("bonus_collateral")
    BigInteger bonusCollateral;

    @JsonProperty("health_factor_before")
    BigInteger healthFactorBefore;

    @JsonProperty("health_factor_after")
    BigInteger healthFactorAfter;

    public static LiquidationResponse from(LiquidationResult result) {
        return LiquidationResponse.builder()
            .targetAccount(result.getTarget().getValue())
            .collateralAsset(result.getCollateralAsset().getValue())
            .debtCovered(result.getDebtCovered())
            .collateralSeized(result.getCollateralSeized())
            .bonusCollateral(result.getBonusCollateral())
            .healthFactorBefore(result.getHealthFactorBefore())
            .healthFactorAfter(result.getHealthFactorAfter())
            .build();
    }
}

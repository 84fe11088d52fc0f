package com.flagship.collateral_engine.engine;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.ledger.AccountId;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a committed liquidation.
 */
@Value
@Builder
public class LiquidationResult {
    AccountId target;
    AccountId liquidator;
    AssetId collateralAsset;
    BigInteger debtCovered;
    BigInteger collateralSeized;
    BigInteger bonusCollateral;
    BigInteger healthFactorBefore;
    BigInteger healthFactorAfter;
}

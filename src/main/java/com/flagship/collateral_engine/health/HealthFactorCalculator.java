package com.flagship.collateral_engine.health;

import com.flagship.collateral_engine.ledger.Amounts;

import java.math.BigInteger;

/**
 * Solvency ratio of a position.
 *
 * healthFactor = (collateralUsd * thresholdPct / 100) * precision / debt
 *
 * Both divisions round down, so a borderline position is judged against the
 * caller's favour. A position without debt is always healthy.
 */
public final class HealthFactorCalculator {

    public static final BigInteger LIQUIDATION_PRECISION = BigInteger.valueOf(100);
    public static final BigInteger MAX_HEALTH_FACTOR = Amounts.MAX_UINT256;

    private HealthFactorCalculator() {
        // Utility class
    }

    public static BigInteger compute(BigInteger debt, BigInteger collateralUsdValue,
                                     BigInteger thresholdPct, BigInteger precision) {
        if (debt.signum() == 0) {
            return MAX_HEALTH_FACTOR;
        }
        BigInteger adjusted = collateralUsdValue.multiply(thresholdPct).divide(LIQUIDATION_PRECISION);
        return adjusted.multiply(precision).divide(debt);
    }
}

package com.flagship.collateral_engine.engine.exception;

import lombok.Getter;

import java.math.BigInteger;

/**
 * Liquidation request rejected: target not eligible, or the liquidation would not help.
 */
@Getter
public class LiquidationException extends EngineException {

    private final BigInteger healthFactor;

    public LiquidationException(EngineError error, String message, BigInteger healthFactor) {
        super(error, message);
        this.healthFactor = healthFactor;
    }
}

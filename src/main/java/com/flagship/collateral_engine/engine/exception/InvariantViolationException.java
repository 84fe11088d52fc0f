package com.flagship.collateral_engine.engine.exception;

import lombok.Getter;

import java.math.BigInteger;

/**
 * The solvency invariant (or the serialization invariant) would not hold after the operation.
 * Carries the computed health factor when one was evaluated.
 */
@Getter
public class InvariantViolationException extends EngineException {

    private final BigInteger healthFactor;

    public InvariantViolationException(EngineError error, BigInteger healthFactor) {
        super(error, String.format("%s: health factor %s is below the minimum", error, healthFactor));
        this.healthFactor = healthFactor;
    }

    public InvariantViolationException(EngineError error, String message) {
        super(error, message);
        this.healthFactor = null;
    }
}

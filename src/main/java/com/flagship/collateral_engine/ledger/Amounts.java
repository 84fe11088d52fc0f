package com.flagship.collateral_engine.ledger;

import com.flagship.collateral_engine.engine.exception.EngineError;
import com.flagship.collateral_engine.engine.exception.ValidationException;

import java.math.BigInteger;

/**
 * Fixed-point constants and amount guards shared by the ledger, oracle and engine.
 *
 * All quantities are unsigned integers scaled by {@link #PRECISION} (18 decimals)
 * and bounded by the unsigned 256-bit range.
 */
public final class Amounts {

    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Amounts() {
        // Utility class
    }

    /**
     * Rejects null, zero, negative and out-of-range amounts.
     *
     * @param amount amount to check
     * @param field name used in the error message
     * @return the same amount
     */
    public static BigInteger requirePositive(BigInteger amount, String field) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(EngineError.AMOUNT_MUST_BE_POSITIVE,
                String.format("%s must be greater than zero, got %s", field, amount));
        }
        return requireInRange(amount, field);
    }

    public static BigInteger requireInRange(BigInteger amount, String field) {
        if (amount.compareTo(MAX_UINT256) > 0) {
            throw new ValidationException(EngineError.AMOUNT_OUT_OF_RANGE,
                String.format("%s exceeds the unsigned 256-bit range", field));
        }
        return amount;
    }
}

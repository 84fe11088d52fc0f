package com.flagship.collateral_engine.engine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Specific failure codes, each bound to its {@link ErrorCategory}.
 */
@Getter
@RequiredArgsConstructor
public enum EngineError {
    AMOUNT_MUST_BE_POSITIVE(ErrorCategory.VALIDATION),
    AMOUNT_OUT_OF_RANGE(ErrorCategory.VALIDATION),
    ASSET_NOT_ALLOWED(ErrorCategory.VALIDATION),
    LENGTH_MISMATCH(ErrorCategory.VALIDATION),
    DUPLICATE_ASSET(ErrorCategory.VALIDATION),
    INSUFFICIENT_COLLATERAL(ErrorCategory.VALIDATION),
    INSUFFICIENT_DEBT(ErrorCategory.VALIDATION),

    BREAKS_HEALTH_FACTOR(ErrorCategory.INVARIANT_VIOLATION),
    HEALTH_FACTOR_BROKEN(ErrorCategory.INVARIANT_VIOLATION),
    REENTRANT_CALL(ErrorCategory.INVARIANT_VIOLATION),

    TRANSFER_FAILED(ErrorCategory.COLLABORATOR_FAILURE),
    MINT_FAILED(ErrorCategory.COLLABORATOR_FAILURE),
    BURN_FAILED(ErrorCategory.COLLABORATOR_FAILURE),

    ORACLE_STALE(ErrorCategory.ORACLE_FAILURE),
    ORACLE_UNAVAILABLE(ErrorCategory.ORACLE_FAILURE),

    HEALTH_FACTOR_OK(ErrorCategory.LIQUIDATION_NOT_ELIGIBLE),
    HEALTH_FACTOR_NOT_IMPROVED(ErrorCategory.LIQUIDATION_INEFFECTIVE);

    private final ErrorCategory category;
}

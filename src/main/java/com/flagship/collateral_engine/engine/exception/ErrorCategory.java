package com.flagship.collateral_engine.engine.exception;

/**
 * Broad failure classes an engine operation can end in.
 * Every category implies the same thing for ledger state: nothing persisted.
 */
public enum ErrorCategory {
    VALIDATION,
    INVARIANT_VIOLATION,
    COLLABORATOR_FAILURE,
    ORACLE_FAILURE,
    LIQUIDATION_NOT_ELIGIBLE,
    LIQUIDATION_INEFFECTIVE
}

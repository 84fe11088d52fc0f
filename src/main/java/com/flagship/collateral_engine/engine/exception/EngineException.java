package com.flagship.collateral_engine.engine.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by the collateral engine.
 *
 * A thrown EngineException means the operation did not commit: ledger state,
 * collaborator side effects and pending events are all rolled back before it
 * reaches the caller.
 */
@Getter
public abstract class EngineException extends RuntimeException {

    private final EngineError error;

    protected EngineException(EngineError error, String message) {
        super(message);
        this.error = error;
    }

    protected EngineException(EngineError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ErrorCategory getCategory() {
        return error.getCategory();
    }
}

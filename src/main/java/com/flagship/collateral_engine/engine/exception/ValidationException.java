package com.flagship.collateral_engine.engine.exception;

/**
 * Input rejected before any state was touched.
 */
public class ValidationException extends EngineException {

    public ValidationException(EngineError error, String message) {
        super(error, message);
    }
}

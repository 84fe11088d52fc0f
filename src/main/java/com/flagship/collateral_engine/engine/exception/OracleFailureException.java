package com.flagship.collateral_engine.engine.exception;

/**
 * Price could not be obtained, or the latest reading is too old to be trusted.
 */
public class OracleFailureException extends EngineException {

    public OracleFailureException(EngineError error, String message) {
        super(error, message);
    }

    public OracleFailureException(EngineError error, String message, Throwable cause) {
        super(error, message, cause);
    }
}

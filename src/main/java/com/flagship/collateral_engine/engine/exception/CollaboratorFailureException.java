package com.flagship.collateral_engine.engine.exception;

/**
 * A token or transfer collaborator refused (or threw while performing) a request.
 */
public class CollaboratorFailureException extends EngineException {

    public CollaboratorFailureException(EngineError error, String message) {
        super(error, message);
    }

    public CollaboratorFailureException(EngineError error, String message, Throwable cause) {
        super(error, message, cause);
    }
}

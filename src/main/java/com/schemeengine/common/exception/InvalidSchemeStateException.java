package com.schemeengine.common.exception;

/**
 * Thrown when an operation is attempted while the scheme is in the wrong state
 * or outside the time window the operation requires.
 */
public class InvalidSchemeStateException extends SchemeEngineException {

    private final String schemeId;
    private final String currentState;
    private final String operation;

    public InvalidSchemeStateException(String schemeId, String currentState, String operation, String reason) {
        super(String.format("Cannot perform operation '%s' on scheme %s in state %s: %s",
            operation, schemeId, currentState, reason));
        this.schemeId = schemeId;
        this.currentState = currentState;
        this.operation = operation;
    }

    public String getSchemeId() {
        return schemeId;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getOperation() {
        return operation;
    }
}

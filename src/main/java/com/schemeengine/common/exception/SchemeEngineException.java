package com.schemeengine.common.exception;

/**
 * Base exception for all scheme engine exceptions.
 */
public class SchemeEngineException extends RuntimeException {

    public SchemeEngineException(String message) {
        super(message);
    }

    public SchemeEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

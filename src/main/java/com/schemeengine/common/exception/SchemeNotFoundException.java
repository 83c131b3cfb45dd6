package com.schemeengine.common.exception;

/**
 * Thrown when a scheme is not found.
 */
public class SchemeNotFoundException extends SchemeEngineException {

    public SchemeNotFoundException(String schemeId) {
        super("Scheme not found: " + schemeId);
    }
}

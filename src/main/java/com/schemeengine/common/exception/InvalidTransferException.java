package com.schemeengine.common.exception;

/**
 * Thrown when a transfer or contribution names an invalid holder: a blank or
 * self recipient, or the scheme's own custody account.
 */
public class InvalidTransferException extends SchemeEngineException {

    public InvalidTransferException(String message) {
        super(message);
    }
}

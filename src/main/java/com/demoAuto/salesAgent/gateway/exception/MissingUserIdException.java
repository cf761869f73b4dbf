package com.demoAuto.salesAgent.gateway.exception;

/**
 * Exception thrown when the user ID header is missing or blank.
 */
public class MissingUserIdException extends RuntimeException {

    public MissingUserIdException(String message) {
        super(message);
    }
}

package com.demoAuto.salesAgent.finance.exception;

/**
 * Base class for inputs the financing engine refuses to calculate with.
 */
public abstract class FinancingValidationException extends RuntimeException {

    protected FinancingValidationException(String message) {
        super(message);
    }
}

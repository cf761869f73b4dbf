package com.demoAuto.salesAgent.finance.exception;

public class InvalidDownPaymentException extends FinancingValidationException {

    public InvalidDownPaymentException(String message) {
        super(message);
    }
}

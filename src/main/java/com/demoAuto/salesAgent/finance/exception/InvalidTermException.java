package com.demoAuto.salesAgent.finance.exception;

public class InvalidTermException extends FinancingValidationException {

    public InvalidTermException(int termYears, int minYears, int maxYears) {
        super("Term must be between " + minYears + " and " + maxYears + " years, got " + termYears);
    }
}

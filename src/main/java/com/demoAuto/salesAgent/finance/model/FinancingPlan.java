package com.demoAuto.salesAgent.finance.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of an amortization calculation. All amounts are MXN rounded to 2 decimals.
 *
 * financedAmount = price - downPayment
 * totalPaid      = monthlyPayment * termMonths + downPayment (within rounding)
 * totalInterest  = totalPaid - price
 */
@Value
@Builder
public class FinancingPlan {

    BigDecimal price;
    BigDecimal downPayment;
    BigDecimal annualRate;
    int termYears;
    int termMonths;
    BigDecimal financedAmount;
    BigDecimal monthlyPayment;
    BigDecimal totalPaid;
    BigDecimal totalInterest;
}

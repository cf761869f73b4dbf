package com.demoAuto.salesAgent.finance.service;

import com.demoAuto.salesAgent.finance.model.FinancingPlan;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Plain-text rendering of a {@link FinancingPlan}. Used as the grounding block for the
 * phrasing prompt and as the reply itself when text generation is unavailable.
 */
public final class FinancingPlanFormatter {

    private FinancingPlanFormatter() {}

    public static String describe(FinancingPlan plan) {
        if (plan.getTermMonths() == 0) {
            return "Your down payment of " + money(plan.getDownPayment())
                    + " covers the full price of " + money(plan.getPrice())
                    + ", so there is nothing left to finance.";
        }
        return "Financing plan\n"
                + "Vehicle price: " + money(plan.getPrice()) + "\n"
                + "Down payment: " + money(plan.getDownPayment()) + "\n"
                + "Financed amount: " + money(plan.getFinancedAmount()) + "\n"
                + "Term: " + plan.getTermYears() + " years (" + plan.getTermMonths() + " months)\n"
                + "Monthly payment: " + money(plan.getMonthlyPayment()) + "\n"
                + "Total paid: " + money(plan.getTotalPaid()) + "\n"
                + "Total interest: " + money(plan.getTotalInterest()) + "\n"
                + "Fixed annual rate: " + percent(plan.getAnnualRate());
    }

    static String money(BigDecimal amount) {
        NumberFormat format = NumberFormat.getNumberInstance(Locale.US);
        format.setMinimumFractionDigits(2);
        format.setMaximumFractionDigits(2);
        return "$" + format.format(amount) + " MXN";
    }

    static String percent(BigDecimal rate) {
        return rate.movePointRight(2).stripTrailingZeros().toPlainString() + "%";
    }
}

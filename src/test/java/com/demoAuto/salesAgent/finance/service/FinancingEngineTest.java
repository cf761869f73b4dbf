package com.demoAuto.salesAgent.finance.service;

import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.finance.exception.InvalidDownPaymentException;
import com.demoAuto.salesAgent.finance.exception.InvalidTermException;
import com.demoAuto.salesAgent.finance.model.FinancingPlan;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FinancingEngineTest {

    private static final BigDecimal RATE = new BigDecimal("0.10");
    private static final BigDecimal CENT = new BigDecimal("0.01");

    private final FinancingEngine engine = new FinancingEngine(new SalesAgentProperties());

    @Test
    void standardPlanMatchesAmortizationFormula() {
        FinancingPlan plan = engine.calculate(new BigDecimal("300000"), new BigDecimal("60000"), RATE, 4);

        assertEquals(new BigDecimal("240000.00"), plan.getFinancedAmount());
        assertEquals(48, plan.getTermMonths());
        assertEquals(4, plan.getTermYears());
        assertEquals(new BigDecimal("6087.02"), plan.getMonthlyPayment());
        assertEquals(new BigDecimal("352176.96"), plan.getTotalPaid());
        assertEquals(new BigDecimal("52176.96"), plan.getTotalInterest());
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 4, 5, 6})
    void totalsAreConsistentWithinRounding(int termYears) {
        BigDecimal price = new BigDecimal("415000");
        BigDecimal down = new BigDecimal("83000");
        FinancingPlan plan = engine.calculate(price, down, RATE, termYears);

        BigDecimal installments = plan.getMonthlyPayment().multiply(BigDecimal.valueOf(plan.getTermMonths()));
        // monthly payment is rounded to the cent, so the product can drift by up to half a cent per month
        BigDecimal tolerance = CENT.multiply(BigDecimal.valueOf(plan.getTermMonths()));

        assertEquals(termYears * 12, plan.getTermMonths());
        assertEquals(price.subtract(down).setScale(2), plan.getFinancedAmount());
        assertTrue(installments.subtract(plan.getTotalPaid().subtract(down)).abs().compareTo(tolerance) <= 0);
        assertTrue(installments.subtract(plan.getFinancedAmount()).subtract(plan.getTotalInterest()).abs().compareTo(tolerance) <= 0);
        assertTrue(plan.getTotalPaid().subtract(price).subtract(plan.getTotalInterest()).abs().compareTo(CENT) <= 0);
    }

    @Test
    void fullDownPaymentLeavesNothingToFinance() {
        FinancingPlan plan = engine.calculate(new BigDecimal("100000"), new BigDecimal("100000"), RATE, 5);

        assertEquals(0, plan.getFinancedAmount().signum());
        assertEquals(0, plan.getMonthlyPayment().signum());
        assertEquals(0, plan.getTotalInterest().signum());
        assertEquals(0, plan.getTermMonths());
        assertEquals(new BigDecimal("100000.00"), plan.getTotalPaid());
    }

    @Test
    void zeroRateSplitsPrincipalEvenly() {
        FinancingPlan plan = engine.calculate(new BigDecimal("150000"), new BigDecimal("50000"), BigDecimal.ZERO, 3);

        assertEquals(new BigDecimal("2777.78"), plan.getMonthlyPayment());
        assertEquals(new BigDecimal("0.00"), plan.getTotalInterest());
        assertEquals(new BigDecimal("150000.00"), plan.getTotalPaid());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 2, 7, 30})
    void termOutsideRangeIsRejected(int termYears) {
        assertThrows(InvalidTermException.class,
                () -> engine.calculate(new BigDecimal("100000"), new BigDecimal("50000"), RATE, termYears));
    }

    @Test
    void downPaymentAbovePriceIsRejected() {
        assertThrows(InvalidDownPaymentException.class,
                () -> engine.calculate(new BigDecimal("100000"), new BigDecimal("150000"), RATE, 5));
    }

    @Test
    void negativeDownPaymentIsRejected() {
        assertThrows(InvalidDownPaymentException.class,
                () -> engine.calculate(new BigDecimal("100000"), new BigDecimal("-1"), RATE, 5));
    }

    @Test
    void termIsCheckedBeforeDownPayment() {
        assertThrows(InvalidTermException.class,
                () -> engine.calculate(new BigDecimal("100000"), new BigDecimal("150000"), RATE, 9));
    }

    @Test
    void configuredRateIsUsedByDefault() {
        FinancingPlan plan = engine.calculate(new BigDecimal("300000"), new BigDecimal("60000"), 4);

        assertEquals(0, new BigDecimal("0.10").compareTo(plan.getAnnualRate()));
        assertEquals(new BigDecimal("6087.02"), plan.getMonthlyPayment());
    }

    @Test
    void optionsCoverAllCombinationsCheapestFirst() {
        List<FinancingPlan> options = engine.options(new BigDecimal("300000"), null);

        assertEquals(12, options.size());
        for (int i = 1; i < options.size(); i++) {
            assertTrue(options.get(i - 1).getMonthlyPayment().compareTo(options.get(i).getMonthlyPayment()) <= 0);
        }
        FinancingPlan cheapest = options.get(0);
        assertEquals(new BigDecimal("90000.00"), cheapest.getDownPayment());
        assertEquals(6, cheapest.getTermYears());
    }

    @Test
    void optionsRespectMonthlyCeiling() {
        BigDecimal ceiling = new BigDecimal("6000");
        List<FinancingPlan> options = engine.options(new BigDecimal("300000"), ceiling);

        assertFalse(options.isEmpty());
        assertTrue(options.size() < 12);
        options.forEach(plan -> assertTrue(plan.getMonthlyPayment().compareTo(ceiling) <= 0));
    }
}

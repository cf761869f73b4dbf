package com.demoAuto.salesAgent.finance.service;

import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.finance.exception.InvalidDownPaymentException;
import com.demoAuto.salesAgent.finance.exception.InvalidTermException;
import com.demoAuto.salesAgent.finance.model.FinancingPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-rate amortization engine.
 *
 * Inputs are validated and rejected, never clamped: the term must be 3 to 6 years and the
 * down payment must not exceed the price. Callers that accept user input are expected to
 * recover before reaching this class.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinancingEngine {

    public static final int MIN_TERM_YEARS = 3;
    public static final int MAX_TERM_YEARS = 6;

    static final List<BigDecimal> OPTION_DOWN_PAYMENT_SHARES = List.of(
            new BigDecimal("0.10"), new BigDecimal("0.20"), new BigDecimal("0.30"));

    private final SalesAgentProperties properties;

    /**
     * @throws InvalidTermException        if {@code termYears} is outside [3, 6]
     * @throws InvalidDownPaymentException if the down payment is negative or exceeds the price
     */
    public FinancingPlan calculate(BigDecimal price, BigDecimal downPayment, BigDecimal annualRate, int termYears) {
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(downPayment, "downPayment");
        Objects.requireNonNull(annualRate, "annualRate");

        if (termYears < MIN_TERM_YEARS || termYears > MAX_TERM_YEARS) {
            throw new InvalidTermException(termYears, MIN_TERM_YEARS, MAX_TERM_YEARS);
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("Price must not be negative");
        }
        if (annualRate.signum() < 0) {
            throw new IllegalArgumentException("Annual rate must not be negative");
        }
        if (downPayment.signum() < 0) {
            throw new InvalidDownPaymentException("Down payment must not be negative");
        }
        if (downPayment.compareTo(price) > 0) {
            throw new InvalidDownPaymentException("Down payment " + downPayment.toPlainString()
                    + " exceeds price " + price.toPlainString());
        }

        BigDecimal financed = price.subtract(downPayment);
        if (financed.signum() <= 0) {
            return FinancingPlan.builder()
                    .price(money(price))
                    .downPayment(money(downPayment))
                    .annualRate(annualRate)
                    .termYears(0)
                    .termMonths(0)
                    .financedAmount(money(BigDecimal.ZERO))
                    .monthlyPayment(money(BigDecimal.ZERO))
                    .totalPaid(money(downPayment))
                    .totalInterest(money(BigDecimal.ZERO))
                    .build();
        }

        int months = termYears * 12;
        double principal = financed.doubleValue();
        double r = annualRate.doubleValue() / 12.0;
        double monthly = r == 0.0
                ? principal / months
                : (r * principal) / (1.0 - Math.pow(1.0 + r, -months));
        double paidInInstallments = monthly * months;

        return FinancingPlan.builder()
                .price(money(price))
                .downPayment(money(downPayment))
                .annualRate(annualRate)
                .termYears(termYears)
                .termMonths(months)
                .financedAmount(money(financed))
                .monthlyPayment(money(monthly))
                .totalPaid(money(paidInInstallments + downPayment.doubleValue()))
                .totalInterest(money(r == 0.0 ? 0.0 : paidInInstallments - principal))
                .build();
    }

    /**
     * Plan at the configured annual rate.
     */
    public FinancingPlan calculate(BigDecimal price, BigDecimal downPayment, int termYears) {
        return calculate(price, downPayment, properties.getFinance().getAnnualRate(), termYears);
    }

    /**
     * Every combination of 10/20/30 % down payment and 3..6 year term at the configured rate,
     * cheapest monthly payment first. Plans above {@code maxMonthlyPayment} are dropped when it is set.
     */
    public List<FinancingPlan> options(BigDecimal price, BigDecimal maxMonthlyPayment) {
        List<FinancingPlan> options = new ArrayList<>();
        for (BigDecimal share : OPTION_DOWN_PAYMENT_SHARES) {
            BigDecimal downPayment = price.multiply(share);
            for (int term = MIN_TERM_YEARS; term <= MAX_TERM_YEARS; term++) {
                FinancingPlan plan = calculate(price, downPayment, term);
                if (maxMonthlyPayment == null || plan.getMonthlyPayment().compareTo(maxMonthlyPayment) <= 0) {
                    options.add(plan);
                }
            }
        }
        options.sort(Comparator.comparing(FinancingPlan::getMonthlyPayment)
                .thenComparing(FinancingPlan::getDownPayment)
                .thenComparingInt(FinancingPlan::getTermYears));
        log.debug("Financing options computed - price: {}, options: {}", price, options.size());
        return options;
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}

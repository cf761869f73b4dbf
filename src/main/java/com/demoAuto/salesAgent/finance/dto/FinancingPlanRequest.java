package com.demoAuto.salesAgent.finance.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for a direct plan calculation. The term range and the down payment ceiling
 * are left to the engine so its own errors reach the caller.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinancingPlanRequest {

    @NotNull(message = "price is required")
    @PositiveOrZero
    private BigDecimal price;

    @NotNull(message = "downPayment is required")
    private BigDecimal downPayment;

    @NotNull(message = "termYears is required")
    private Integer termYears;

    /**
     * Optional; the configured rate is used when absent.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal annualRate;
}

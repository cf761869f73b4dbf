package com.demoAuto.salesAgent.finance.controller;

import com.demoAuto.salesAgent.finance.dto.FinancingPlanRequest;
import com.demoAuto.salesAgent.finance.model.FinancingPlan;
import com.demoAuto.salesAgent.finance.service.FinancingEngine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * Finance REST controller - exposes the amortization engine directly.
 * Engine validation errors are mapped to 400 by the global exception handler.
 */
@RestController
@RequestMapping("/api/v1/finance")
@Validated
@RequiredArgsConstructor
public class FinanceController {

    private final FinancingEngine financingEngine;

    @PostMapping("/plans")
    public ResponseEntity<FinancingPlan> calculate(@Valid @RequestBody FinancingPlanRequest request) {
        FinancingPlan plan = request.getAnnualRate() == null
                ? financingEngine.calculate(request.getPrice(), request.getDownPayment(), request.getTermYears())
                : financingEngine.calculate(request.getPrice(), request.getDownPayment(), request.getAnnualRate(), request.getTermYears());
        return ResponseEntity.ok(plan);
    }

    @GetMapping("/options")
    public ResponseEntity<List<FinancingPlan>> options(
            @RequestParam @Positive BigDecimal price,
            @RequestParam(required = false) @Positive BigDecimal maxMonthlyPayment) {
        return ResponseEntity.ok(financingEngine.options(price, maxMonthlyPayment));
    }
}

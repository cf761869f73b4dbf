package com.demoAuto.salesAgent.finance.controller;

import com.demoAuto.salesAgent.finance.exception.InvalidTermException;
import com.demoAuto.salesAgent.finance.model.FinancingPlan;
import com.demoAuto.salesAgent.finance.service.FinancingEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = FinanceController.class)
class FinanceControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private FinancingEngine financingEngine;

    private static FinancingPlan plan() {
        return FinancingPlan.builder()
                .price(new BigDecimal("300000.00"))
                .downPayment(new BigDecimal("60000.00"))
                .annualRate(new BigDecimal("0.10"))
                .termYears(4)
                .termMonths(48)
                .financedAmount(new BigDecimal("240000.00"))
                .monthlyPayment(new BigDecimal("6087.02"))
                .totalPaid(new BigDecimal("352176.96"))
                .totalInterest(new BigDecimal("52176.96"))
                .build();
    }

    @Test
    void planUsesConfiguredRateWhenNoneGiven() throws Exception {
        when(financingEngine.calculate(any(BigDecimal.class), any(BigDecimal.class), eq(4))).thenReturn(plan());

        mvc.perform(post("/api/v1/finance/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": 300000, \"downPayment\": 60000, \"termYears\": 4}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.monthlyPayment").value(6087.02))
                .andExpect(jsonPath("$.termMonths").value(48));
    }

    @Test
    void engineValidationErrorIsBadRequest() throws Exception {
        when(financingEngine.calculate(any(BigDecimal.class), any(BigDecimal.class), eq(9)))
                .thenThrow(new InvalidTermException(9, 3, 6));

        mvc.perform(post("/api/v1/finance/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": 300000, \"downPayment\": 60000, \"termYears\": 9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_FINANCING_INPUT"))
                .andExpect(jsonPath("$.message").value("Term must be between 3 and 6 years, got 9"));
    }

    @Test
    void missingFieldIsValidationError() throws Exception {
        mvc.perform(post("/api/v1/finance/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": 300000, \"termYears\": 4}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("downPayment: downPayment is required"));

        verifyNoInteractions(financingEngine);
    }

    @Test
    void optionsAreListed() throws Exception {
        when(financingEngine.options(any(BigDecimal.class), isNull())).thenReturn(List.of(plan()));

        mvc.perform(get("/api/v1/finance/options").param("price", "300000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].downPayment").value(60000.0));
    }

    @Test
    void nonPositivePriceIsRejected() throws Exception {
        mvc.perform(get("/api/v1/finance/options").param("price", "-5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(financingEngine);
    }
}

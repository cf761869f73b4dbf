package com.demoAuto.salesAgent.orchestrator.handler;

import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.catalog.store.CatalogStore;
import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.finance.model.FinancingPlan;
import com.demoAuto.salesAgent.finance.service.FinancingEngine;
import com.demoAuto.salesAgent.finance.service.FinancingPlanFormatter;
import com.demoAuto.salesAgent.llm.model.ChatMessage;
import com.demoAuto.salesAgent.llm.service.TextGeneration;
import com.demoAuto.salesAgent.orchestrator.model.HandlerRequest;
import com.demoAuto.salesAgent.orchestrator.model.HandlerResponse;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import com.demoAuto.salesAgent.orchestrator.prompt.FinanceExtractionPrompt;
import com.demoAuto.salesAgent.orchestrator.prompt.FinanceResponsePrompt;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Turns a financing question into a calculated plan.
 *
 * Flow:
 * EXTRACT (price or car name, down payment, term) -> RESOLVE PRICE (catalog lookup by name)
 * -> VALIDATE (ask instead of calling the engine with bad input) -> CALCULATE -> PHRASE
 *
 * The engine is only called with a term in range and a down payment not above the price.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class FinanceHandler implements IntentHandler {

    private final TextGeneration textGeneration;
    private final FinancingEngine financingEngine;
    private final CatalogStore catalogStore;
    private final ObjectMapper objectMapper;
    private final SalesAgentProperties properties;

    @Override
    public Intent intent() {
        return Intent.FINANCE_CALCULATION;
    }

    @Override
    public HandlerResponse handle(HandlerRequest request) {
        String correlationId = request.getCorrelationId();
        try {
            FinanceParameters params = extract(request);
            log.debug("Finance parameters extracted - correlationId: {}, params: {}", correlationId, params);

            if (params.downPayment() == null) {
                log.info("Down payment missing, asking customer - correlationId: {}", correlationId);
                return HandlerResponse.text(FinanceResponsePrompt.ASK_DOWN_PAYMENT);
            }

            BigDecimal price = params.price();
            List<VehicleRecord> cars = List.of();
            if (price == null) {
                if (params.carName() == null) {
                    log.info("Price and car name missing, asking customer - correlationId: {}", correlationId);
                    return HandlerResponse.text(FinanceResponsePrompt.ASK_PRICE);
                }
                Optional<VehicleRecord> car = catalogStore.byName(params.carName());
                if (car.isEmpty()) {
                    log.info("Car not found in catalog - correlationId: {}, carName: {}", correlationId, params.carName());
                    return HandlerResponse.text(FinanceResponsePrompt.carNotFound(
                            params.carName(), VehicleRecord.formatMoney(params.downPayment()) + " MXN"));
                }
                price = car.get().getPrice();
                cars = List.of(car.get());
                log.info("Price resolved from catalog - correlationId: {}, stockId: {}, price: {}",
                        correlationId, car.get().getStockId(), price);
            }

            int termYears = resolveTerm(params.termYears(), correlationId);

            if (params.downPayment().compareTo(price) > 0) {
                return HandlerResponse.text(FinanceResponsePrompt.downPaymentExceedsPrice(
                        VehicleRecord.formatMoney(params.downPayment()) + " MXN",
                        VehicleRecord.formatMoney(price) + " MXN"));
            }

            FinancingPlan plan = financingEngine.calculate(price, params.downPayment(), termYears);
            log.info("Financing calculated - correlationId: {}, monthlyPayment: {}, termMonths: {}",
                    correlationId, plan.getMonthlyPayment(), plan.getTermMonths());

            return HandlerResponse.builder()
                    .text(phrase(request, plan))
                    .cars(cars)
                    .financingPlan(plan)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Finance handler failed - correlationId: {}, error: {}", correlationId, e.getMessage());
            return HandlerResponse.text(FinanceResponsePrompt.RECOVERY);
        }
    }

    private FinanceParameters extract(HandlerRequest request) {
        String raw = textGeneration.complete(List.of(
                ChatMessage.system(FinanceExtractionPrompt.SYSTEM_PROMPT),
                ChatMessage.user(FinanceExtractionPrompt.userPrompt(request.getQuery(), request.getHistory()))));
        return FinanceParameters.parse(raw, objectMapper);
    }

    /**
     * Missing or out-of-range terms fall back to the configured default.
     */
    int resolveTerm(Integer requested, String correlationId) {
        if (requested != null
                && requested >= FinancingEngine.MIN_TERM_YEARS
                && requested <= FinancingEngine.MAX_TERM_YEARS) {
            return requested;
        }
        int fallback = properties.getFinance().getDefaultTermYears();
        log.info("Term missing or out of range, using default - correlationId: {}, requested: {}, default: {}",
                correlationId, requested, fallback);
        return fallback;
    }

    private String phrase(HandlerRequest request, FinancingPlan plan) {
        String description = FinancingPlanFormatter.describe(plan);
        try {
            return textGeneration.complete(List.of(
                    ChatMessage.system(FinanceResponsePrompt.SYSTEM_PROMPT),
                    ChatMessage.user(FinanceResponsePrompt.userPrompt(request.getQuery(), description))));
        } catch (RuntimeException e) {
            log.warn("Plan phrasing failed, returning plain description - correlationId: {}, error: {}",
                    request.getCorrelationId(), e.getMessage());
            return description;
        }
    }
}

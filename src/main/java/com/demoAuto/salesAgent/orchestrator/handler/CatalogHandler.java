package com.demoAuto.salesAgent.orchestrator.handler;

import com.demoAuto.salesAgent.catalog.model.ScoredVehicle;
import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.catalog.service.CarSearchService;
import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.llm.model.ChatMessage;
import com.demoAuto.salesAgent.llm.service.TextGeneration;
import com.demoAuto.salesAgent.orchestrator.model.HandlerRequest;
import com.demoAuto.salesAgent.orchestrator.model.HandlerResponse;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import com.demoAuto.salesAgent.orchestrator.prompt.CatalogRecommendationPrompt;
import com.demoAuto.salesAgent.retrieval.Retrieval;
import com.demoAuto.salesAgent.retrieval.ScoredItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Finds the top-K catalog matches for a message and asks for a recommendation limited to them.
 *
 * Search order: semantic index (when enabled), then keyword match, then fuzzy make/model match.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class CatalogHandler implements IntentHandler {

    static final String FALLBACK = "Sorry, I had a problem searching the catalog. Could you try again?";

    private final TextGeneration textGeneration;
    private final Retrieval<VehicleRecord> catalogIndex;
    private final CarSearchService carSearchService;
    private final SalesAgentProperties properties;

    @Override
    public Intent intent() {
        return Intent.CATALOG_SEARCH;
    }

    @Override
    public HandlerResponse handle(HandlerRequest request) {
        String correlationId = request.getCorrelationId();
        try {
            List<VehicleRecord> cars = findCars(request.getQuery(), correlationId);
            String context = cars.isEmpty() ? CatalogRecommendationPrompt.NO_MATCHES : contextBlock(cars);

            String answer = textGeneration.complete(List.of(
                    ChatMessage.system(CatalogRecommendationPrompt.systemPrompt(context)),
                    ChatMessage.user(request.userContent())));

            log.info("Catalog answer generated - correlationId: {}, cars: {}", correlationId, cars.size());
            return HandlerResponse.builder().text(answer).cars(cars).build();
        } catch (RuntimeException e) {
            log.warn("Catalog handler failed - correlationId: {}, error: {}", correlationId, e.getMessage());
            return HandlerResponse.text(FALLBACK);
        }
    }

    List<VehicleRecord> findCars(String query, String correlationId) {
        int topK = properties.getCatalog().getTopK();

        if (properties.getCatalog().isSemanticSearch()) {
            try {
                List<VehicleRecord> semantic = catalogIndex.topK(query, topK).stream()
                        .map(ScoredItem::item)
                        .toList();
                if (!semantic.isEmpty()) {
                    log.debug("Semantic catalog search - correlationId: {}, results: {}", correlationId, semantic.size());
                    return semantic;
                }
            } catch (RuntimeException e) {
                log.warn("Semantic catalog search unavailable, using keyword search - correlationId: {}, error: {}",
                        correlationId, e.getMessage());
            }
        }

        return carSearchService.search(query).stream()
                .limit(topK)
                .map(ScoredVehicle::getVehicle)
                .toList();
    }

    static String contextBlock(List<VehicleRecord> cars) {
        NumberFormat km = NumberFormat.getIntegerInstance(Locale.US);
        return "Available cars:\n" + cars.stream()
                .map(car -> "- " + car.getMake() + " " + car.getModel() + " " + car.getYear()
                        + (car.getVersion() == null ? "" : " " + car.getVersion())
                        + " - " + car.getFormattedPrice()
                        + ", " + km.format(car.getMileageKm()) + " km"
                        + (car.hasBluetooth() ? ", Bluetooth" : "")
                        + (car.hasCarPlay() ? ", CarPlay" : "")
                        + " (stock " + car.getStockId() + ")")
                .collect(Collectors.joining("\n"));
    }
}

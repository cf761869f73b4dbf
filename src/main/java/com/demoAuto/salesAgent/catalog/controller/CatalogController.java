package com.demoAuto.salesAgent.catalog.controller;

import com.demoAuto.salesAgent.catalog.dto.RecommendationRequest;
import com.demoAuto.salesAgent.catalog.exception.VehicleNotFoundException;
import com.demoAuto.salesAgent.catalog.model.CatalogStats;
import com.demoAuto.salesAgent.catalog.model.RecommendationResult;
import com.demoAuto.salesAgent.catalog.model.ScoredVehicle;
import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.catalog.service.CarSearchService;
import com.demoAuto.salesAgent.catalog.service.RecommendationService;
import com.demoAuto.salesAgent.catalog.store.CatalogStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Catalog REST controller - direct access to search, recommendations and similar vehicles,
 * outside the conversational pipeline.
 */
@RestController
@RequestMapping("/api/v1/catalog")
@Validated
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogStore catalogStore;
    private final CarSearchService carSearchService;
    private final RecommendationService recommendationService;

    @PostMapping("/recommendations")
    public ResponseEntity<RecommendationResult> recommend(@Valid @RequestBody RecommendationRequest request) {
        return ResponseEntity.ok(recommendationService.recommend(request.toPreferences(), request.getLimit()));
    }

    @GetMapping("/search")
    public ResponseEntity<List<ScoredVehicle>> search(@RequestParam("q") @NotBlank String query) {
        return ResponseEntity.ok(carSearchService.search(query));
    }

    @GetMapping("/vehicles/{stockId}/similar")
    public ResponseEntity<List<ScoredVehicle>> similar(
            @PathVariable String stockId,
            @RequestParam(defaultValue = "3") @Min(1) @Max(20) int limit) {

        VehicleRecord vehicle = catalogStore.byStockId(stockId)
                .orElseThrow(() -> new VehicleNotFoundException(stockId));
        return ResponseEntity.ok(recommendationService.findSimilar(vehicle, limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<CatalogStats> stats() {
        return ResponseEntity.ok(catalogStore.stats());
    }
}

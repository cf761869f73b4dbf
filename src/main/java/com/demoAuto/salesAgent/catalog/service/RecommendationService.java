package com.demoAuto.salesAgent.catalog.service;

import com.demoAuto.salesAgent.catalog.model.CustomerPreferences;
import com.demoAuto.salesAgent.catalog.model.RecommendationResult;
import com.demoAuto.salesAgent.catalog.model.ScoredVehicle;
import com.demoAuto.salesAgent.catalog.model.SearchCriteria;
import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.catalog.scoring.RecommendationScorer;
import com.demoAuto.salesAgent.catalog.store.CatalogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Preference-based recommendations and similar-vehicle lookups.
 *
 * Responsibilities:
 * - Apply hard filters, then rank survivors by soft score
 * - Report the pre-limit match count and a human-readable rationale
 * - Find vehicles similar to a given one
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private final CatalogStore catalogStore;
    private final Clock clock;

    public RecommendationResult recommend(CustomerPreferences preferences, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        int currentYear = Year.now(clock).getValue();

        List<ScoredVehicle> matches = catalogStore.all().stream()
                .filter(v -> RecommendationScorer.passesHardFilters(v, preferences))
                .map(v -> new ScoredVehicle(v, RecommendationScorer.softScore(v, preferences, currentYear)))
                .sorted(CarSearchService.BY_SCORE_THEN_STOCK_ID)
                .toList();

        log.info("Recommendation computed - matches: {}, limit: {}", matches.size(), limit);

        return RecommendationResult.builder()
                .recommendations(matches.stream().limit(limit).toList())
                .totalMatches(matches.size())
                .rationale(rationale(preferences, matches.size()))
                .searchCriteria(SearchCriteria.from(preferences))
                .build();
    }

    /**
     * Vehicles most similar to {@code vehicle}, excluding the vehicle itself.
     */
    public List<ScoredVehicle> findSimilar(VehicleRecord vehicle, int limit) {
        return catalogStore.all().stream()
                .filter(other -> !other.getStockId().equals(vehicle.getStockId()))
                .map(other -> new ScoredVehicle(other, RecommendationScorer.similarity(vehicle, other)))
                .sorted(CarSearchService.BY_SCORE_THEN_STOCK_ID)
                .limit(limit)
                .toList();
    }

    static String rationale(CustomerPreferences preferences, int totalMatches) {
        List<String> clauses = new ArrayList<>();
        if (preferences.getMaxPrice() != null) {
            clauses.add("within your budget of " + VehicleRecord.formatMoney(preferences.getMaxPrice()));
        }
        if (!preferences.getPreferredMakes().isEmpty()) {
            clauses.add("from preferred brands: " + String.join(", ", preferences.getPreferredMakes()));
        }
        if (preferences.getMaxKm() != null) {
            clauses.add(String.format(Locale.US, "with less than %,d km", preferences.getMaxKm()));
        }
        if (preferences.getMinYear() != null) {
            clauses.add("manufactured after " + preferences.getMinYear());
        }

        String base = "Found " + totalMatches + " cars";
        return clauses.isEmpty() ? base : base + " " + String.join(" and ", clauses);
    }
}

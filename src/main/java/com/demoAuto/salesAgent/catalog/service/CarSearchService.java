package com.demoAuto.salesAgent.catalog.service;

import com.demoAuto.salesAgent.catalog.model.ScoredVehicle;
import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.catalog.scoring.TextMatchScorer;
import com.demoAuto.salesAgent.catalog.store.CatalogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Free-text catalog search over the scoring engine.
 *
 * Results are ordered by score descending, then stock id ascending, so the same query
 * against the same catalog always returns the same list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CarSearchService {

    static final Comparator<ScoredVehicle> BY_SCORE_THEN_STOCK_ID =
            Comparator.comparingDouble(ScoredVehicle::getScore).reversed()
                    .thenComparing(sv -> sv.getVehicle().getStockId());

    private final CatalogStore catalogStore;

    /**
     * Keyword match; records scoring 0 are excluded.
     */
    public List<ScoredVehicle> searchByText(String query) {
        return rank(TextMatchScorer::keywordScore, query, 0.0);
    }

    /**
     * Normalized make/model match; only scores above {@link TextMatchScorer#FUZZY_THRESHOLD} are kept.
     */
    public List<ScoredVehicle> fuzzySearchMakeModel(String query) {
        return rank(TextMatchScorer::fuzzyScore, query, TextMatchScorer.FUZZY_THRESHOLD);
    }

    /**
     * Keyword match first; the fuzzy make/model match only runs when the keyword match is empty.
     */
    public List<ScoredVehicle> search(String query) {
        List<ScoredVehicle> keyword = searchByText(query);
        if (!keyword.isEmpty()) {
            log.debug("Keyword search matched - query: {}, matches: {}", query, keyword.size());
            return keyword;
        }
        List<ScoredVehicle> fuzzy = fuzzySearchMakeModel(query);
        log.debug("Keyword search empty, fuzzy search used - query: {}, matches: {}", query, fuzzy.size());
        return fuzzy;
    }

    private List<ScoredVehicle> rank(Scorer scorer, String query, double threshold) {
        return catalogStore.all().stream()
                .map(v -> new ScoredVehicle(v, scorer.score(v, query)))
                .filter(sv -> sv.getScore() > threshold)
                .sorted(BY_SCORE_THEN_STOCK_ID)
                .toList();
    }

    @FunctionalInterface
    private interface Scorer {
        double score(VehicleRecord vehicle, String query);
    }
}

package com.demoAuto.salesAgent.catalog.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ranked recommendations for one preferences request.
 */
@Value
@Builder
public class RecommendationResult {

    /**
     * Top-ranked vehicles, best first, truncated to the requested limit.
     */
    List<ScoredVehicle> recommendations;

    /**
     * Number of records that passed the hard filters, before the limit was applied.
     */
    int totalMatches;

    String rationale;

    SearchCriteria searchCriteria;
}

package com.demoAuto.salesAgent.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Echo of the preference clauses that were active for a recommendation request.
 * Inactive clauses stay null and are left out of the JSON.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchCriteria {

    BigDecimal minPrice;
    BigDecimal maxPrice;
    Set<String> makes;
    Integer maxKm;
    Integer minYear;
    Integer maxYear;
    Set<String> features;

    public static SearchCriteria from(CustomerPreferences preferences) {
        return SearchCriteria.builder()
                .minPrice(preferences.getMinPrice())
                .maxPrice(preferences.getMaxPrice())
                .makes(preferences.getPreferredMakes().isEmpty() ? null : preferences.getPreferredMakes())
                .maxKm(preferences.getMaxKm())
                .minYear(preferences.getMinYear())
                .maxYear(preferences.getMaxYear())
                .features(preferences.getRequiredFeatures().isEmpty() ? null : preferences.getRequiredFeatures())
                .build();
    }
}

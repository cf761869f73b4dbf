package com.demoAuto.salesAgent.catalog.dto;

import com.demoAuto.salesAgent.catalog.model.CustomerPreferences;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Request DTO for preference-based recommendations.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecommendationRequest {

    @PositiveOrZero
    private BigDecimal minPrice;

    @PositiveOrZero
    private BigDecimal maxPrice;

    private Set<String> preferredMakes;

    @PositiveOrZero
    private Integer maxKm;

    private Integer minYear;

    private Integer maxYear;

    private Set<String> requiredFeatures;

    @Min(1)
    @Max(50)
    @Builder.Default
    private int limit = 5;

    /**
     * @throws IllegalArgumentException if the price or year bounds are inverted
     */
    public CustomerPreferences toPreferences() {
        return CustomerPreferences.builder()
                .minPrice(minPrice)
                .maxPrice(maxPrice)
                .preferredMakes(preferredMakes)
                .maxKm(maxKm)
                .minYear(minYear)
                .maxYear(maxYear)
                .requiredFeatures(requiredFeatures)
                .build();
    }
}

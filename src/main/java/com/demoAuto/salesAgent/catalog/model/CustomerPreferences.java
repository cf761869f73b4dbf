package com.demoAuto.salesAgent.catalog.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Customer preferences for one recommendation request. Every field is optional;
 * an unset field means "no constraint".
 */
@Value
public class CustomerPreferences {

    BigDecimal minPrice;
    BigDecimal maxPrice;
    Set<String> preferredMakes;
    Integer maxKm;
    Integer minYear;
    Integer maxYear;
    Set<String> requiredFeatures;

    @Builder
    public CustomerPreferences(BigDecimal minPrice, BigDecimal maxPrice, Set<String> preferredMakes,
                               Integer maxKm, Integer minYear, Integer maxYear, Set<String> requiredFeatures) {
        if (minPrice != null && maxPrice != null && maxPrice.compareTo(minPrice) <= 0) {
            throw new IllegalArgumentException("maxPrice must be greater than minPrice");
        }
        if (minYear != null && maxYear != null && maxYear < minYear) {
            throw new IllegalArgumentException("maxYear must not be lower than minYear");
        }
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.preferredMakes = preferredMakes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(preferredMakes));
        this.maxKm = maxKm;
        this.minYear = minYear;
        this.maxYear = maxYear;
        this.requiredFeatures = requiredFeatures == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(requiredFeatures));
    }

    public static CustomerPreferences none() {
        return CustomerPreferences.builder().build();
    }

    public boolean hasPriceRange() {
        return minPrice != null && maxPrice != null;
    }
}

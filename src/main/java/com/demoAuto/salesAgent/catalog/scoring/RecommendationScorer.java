package com.demoAuto.salesAgent.catalog.scoring;

import com.demoAuto.salesAgent.catalog.model.CustomerPreferences;
import com.demoAuto.salesAgent.catalog.model.VehicleRecord;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Objects;

/**
 * Preference filtering and scoring for recommendations and similar-vehicle lookups.
 *
 * Soft score = 0.3 * price fit + 0.2 * recency + 0.2 * low mileage
 *            + 0.1 bluetooth + 0.1 carplay + 0.1 recent model.
 */
public final class RecommendationScorer {

    static final double PRICE_WEIGHT = 0.3;
    static final double RECENCY_WEIGHT = 0.2;
    static final double MILEAGE_WEIGHT = 0.2;
    static final double FEATURE_BONUS = 0.1;
    static final double RECENT_MODEL_BONUS = 0.1;

    /**
     * Position of the ideal price inside the preferred range (0 = min, 1 = max).
     */
    static final BigDecimal IDEAL_PRICE_POSITION = new BigDecimal("0.6");

    static final double AGE_HORIZON_YEARS = 15.0;
    static final double MILEAGE_HORIZON_KM = 200_000.0;

    private RecommendationScorer() {}

    /**
     * A record failing any active constraint is excluded outright.
     */
    public static boolean passesHardFilters(VehicleRecord vehicle, CustomerPreferences preferences) {
        if (preferences.getMinPrice() != null && vehicle.getPrice().compareTo(preferences.getMinPrice()) < 0) {
            return false;
        }
        if (preferences.getMaxPrice() != null && vehicle.getPrice().compareTo(preferences.getMaxPrice()) > 0) {
            return false;
        }
        if (!preferences.getPreferredMakes().isEmpty()
                && preferences.getPreferredMakes().stream().noneMatch(make -> make.equalsIgnoreCase(vehicle.getMake()))) {
            return false;
        }
        if (preferences.getMaxKm() != null && vehicle.getMileageKm() > preferences.getMaxKm()) {
            return false;
        }
        if (preferences.getMinYear() != null && vehicle.getYear() < preferences.getMinYear()) {
            return false;
        }
        if (preferences.getMaxYear() != null && vehicle.getYear() > preferences.getMaxYear()) {
            return false;
        }
        for (String feature : preferences.getRequiredFeatures()) {
            String wanted = feature.toLowerCase(Locale.ROOT);
            if (wanted.contains("bluetooth") && !vehicle.hasBluetooth()) {
                return false;
            }
            if ((wanted.contains("carplay") || wanted.contains("car play")) && !vehicle.hasCarPlay()) {
                return false;
            }
        }
        return true;
    }

    public static double softScore(VehicleRecord vehicle, CustomerPreferences preferences, int currentYear) {
        double score = 0.0;

        if (preferences.hasPriceRange()) {
            score += priceFit(vehicle.getPrice(), preferences.getMinPrice(), preferences.getMaxPrice()) * PRICE_WEIGHT;
        }

        int age = vehicle.ageInYears(currentYear);
        score += Math.max(0.0, 1.0 - age / AGE_HORIZON_YEARS) * RECENCY_WEIGHT;
        score += Math.max(0.0, 1.0 - vehicle.getMileageKm() / MILEAGE_HORIZON_KM) * MILEAGE_WEIGHT;

        if (vehicle.hasBluetooth()) {
            score += FEATURE_BONUS;
        }
        if (vehicle.hasCarPlay()) {
            score += FEATURE_BONUS;
        }
        if (vehicle.isRecentModel(currentYear)) {
            score += RECENT_MODEL_BONUS;
        }
        return score;
    }

    /**
     * 1.0 at the ideal price (60% of the way from min to max), falling linearly to 0 at either edge.
     * Returns 0 for an empty or inverted range.
     */
    public static double priceFit(BigDecimal price, BigDecimal min, BigDecimal max) {
        BigDecimal range = max.subtract(min);
        if (range.signum() <= 0) {
            return 0.0;
        }
        BigDecimal ideal = min.add(range.multiply(IDEAL_PRICE_POSITION));
        double fit;
        if (price.compareTo(ideal) <= 0) {
            fit = price.subtract(min).divide(ideal.subtract(min), MathContext.DECIMAL64).doubleValue();
        } else {
            fit = max.subtract(price).divide(max.subtract(ideal), MathContext.DECIMAL64).doubleValue();
        }
        return Math.max(0.0, Math.min(1.0, fit));
    }

    /**
     * Bounded-sum similarity between two records, at most 1.0:
     * same make 0.4, price within 20% 0.3, year within 2 0.2, same bluetooth flag 0.05, same carplay flag 0.05.
     */
    public static double similarity(VehicleRecord a, VehicleRecord b) {
        double score = 0.0;
        if (a.getMake().equalsIgnoreCase(b.getMake())) {
            score += 0.4;
        }
        if (relativePriceDifference(a.getPrice(), b.getPrice()) <= 0.2) {
            score += 0.3;
        }
        if (Math.abs(a.getYear() - b.getYear()) <= 2) {
            score += 0.2;
        }
        if (Objects.equals(a.getBluetooth(), b.getBluetooth())) {
            score += 0.05;
        }
        if (Objects.equals(a.getCarPlay(), b.getCarPlay())) {
            score += 0.05;
        }
        return score;
    }

    static double relativePriceDifference(BigDecimal a, BigDecimal b) {
        BigDecimal larger = a.max(b);
        if (larger.signum() == 0) {
            return 0.0;
        }
        return a.subtract(b).abs().divide(larger, MathContext.DECIMAL64).doubleValue();
    }
}

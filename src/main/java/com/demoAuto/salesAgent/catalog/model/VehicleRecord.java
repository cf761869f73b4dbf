package com.demoAuto.salesAgent.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * A vehicle in the catalog. Immutable once loaded; owned by the catalog store.
 */
@Value
@Builder
public class VehicleRecord {

    public static final int MIN_YEAR = 2000;
    public static final int MAX_YEAR = 2030;

    /**
     * Unique stock identifier.
     */
    String stockId;

    String make;
    String model;
    String version;
    int year;

    /**
     * Price in MXN, never negative.
     */
    BigDecimal price;

    int mileageKm;

    /**
     * Feature flags; null when the source row did not say.
     */
    Boolean bluetooth;
    Boolean carPlay;

    /**
     * Dimensions in millimetres, optional.
     */
    Double lengthMm;
    Double widthMm;
    Double heightMm;

    @JsonIgnore
    public boolean hasBluetooth() {
        return Boolean.TRUE.equals(bluetooth);
    }

    @JsonIgnore
    public boolean hasCarPlay() {
        return Boolean.TRUE.equals(carPlay);
    }

    public int ageInYears(int currentYear) {
        return currentYear - year;
    }

    /**
     * A model from the last 3 years counts as recent.
     */
    public boolean isRecentModel(int currentYear) {
        return ageInYears(currentYear) <= 3;
    }

    @JsonIgnore
    public String getDisplayName() {
        return year + " " + make + " " + model;
    }

    @JsonIgnore
    public String getFormattedPrice() {
        return formatMoney(price) + " MXN";
    }

    public static String formatMoney(BigDecimal amount) {
        NumberFormat format = NumberFormat.getNumberInstance(Locale.US);
        format.setMaximumFractionDigits(0);
        return "$" + format.format(amount);
    }
}

package com.demoAuto.salesAgent.catalog.store;

import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Maps one raw catalog row (snake_case JSON object) to a {@link VehicleRecord}.
 */
final class VehicleRecordMapper {

    private static final Set<String> TRUE_VALUES = Set.of("sí", "si", "yes", "true", "1");
    private static final Set<String> FALSE_VALUES = Set.of("no", "false", "0");

    private VehicleRecordMapper() {}

    /**
     * @throws IllegalArgumentException if a required field is missing or out of range
     */
    static VehicleRecord fromJson(JsonNode row) {
        String stockId = requiredText(row, "stock_id");
        String make = requiredText(row, "make");
        String model = requiredText(row, "model");

        int year = requiredInt(row, "year");
        if (year < VehicleRecord.MIN_YEAR || year > VehicleRecord.MAX_YEAR) {
            throw new IllegalArgumentException("year out of range: " + year);
        }

        BigDecimal price = requiredDecimal(row, "price");
        if (price.signum() < 0) {
            throw new IllegalArgumentException("negative price: " + price);
        }

        int km = requiredInt(row, "km");
        if (km < 0) {
            throw new IllegalArgumentException("negative km: " + km);
        }

        return VehicleRecord.builder()
                .stockId(stockId)
                .make(make)
                .model(model)
                .version(optionalText(row, "version"))
                .year(year)
                .price(price)
                .mileageKm(km)
                .bluetooth(flag(row, "bluetooth"))
                .carPlay(flag(row, "car_play"))
                .lengthMm(optionalDouble(row, "length_mm"))
                .widthMm(optionalDouble(row, "width_mm"))
                .heightMm(optionalDouble(row, "height_mm"))
                .build();
    }

    /**
     * Accepts JSON booleans and the usual yes/no spellings; anything else is "unknown".
     */
    static Boolean flag(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        String value = node.asText().trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(value)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(value)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static String requiredText(JsonNode row, String field) {
        String value = optionalText(row, field);
        if (value == null) {
            throw new IllegalArgumentException("missing field: " + field);
        }
        return value;
    }

    private static String optionalText(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return node.asText().trim();
    }

    /**
     * Whole numbers only: 40000 and 40000.0 are accepted, 2020.5 and anything past int range are rejected.
     */
    private static int requiredInt(JsonNode row, String field) {
        BigDecimal value = requiredDecimal(row, field);
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("not a whole number in range: " + field + "=" + value, e);
        }
    }

    private static BigDecimal requiredDecimal(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("missing field: " + field);
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + field, e);
        }
    }

    private static Double optionalDouble(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

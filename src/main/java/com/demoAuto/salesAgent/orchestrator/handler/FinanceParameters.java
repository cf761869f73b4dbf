package com.demoAuto.salesAgent.orchestrator.handler;

import com.demoAuto.salesAgent.orchestrator.prompt.FinanceExtractionPrompt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;

/**
 * Financing values pulled out of a customer message. A null field means the value was
 * missing or could not be read.
 */
record FinanceParameters(BigDecimal price, String carName, BigDecimal downPayment, Integer termYears) {

    /**
     * Parses the extraction reply. Code fences and text around the JSON object are ignored.
     *
     * @throws IllegalArgumentException if the reply holds no JSON object
     */
    static FinanceParameters parse(String raw, ObjectMapper objectMapper) {
        if (raw == null) {
            throw new IllegalArgumentException("Empty extraction reply");
        }
        String content = raw.replaceAll("```(?:json)?", "").trim();
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("No JSON object in extraction reply");
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed extraction JSON", e);
        }

        return new FinanceParameters(
                amount(json.get("price")),
                text(json.get("car_name")),
                amount(json.get("down_payment")),
                wholeNumber(json.get("term_years")));
    }

    private static boolean isMissing(JsonNode node) {
        return node == null || node.isNull()
                || (node.isTextual() && (node.asText().isBlank()
                || FinanceExtractionPrompt.MISSING.equalsIgnoreCase(node.asText().trim())));
    }

    private static String text(JsonNode node) {
        return isMissing(node) ? null : node.asText().trim();
    }

    /**
     * Non-negative amount; "$250,000" style strings are accepted.
     */
    private static BigDecimal amount(JsonNode node) {
        if (isMissing(node)) {
            return null;
        }
        BigDecimal value;
        if (node.isNumber()) {
            value = node.decimalValue();
        } else {
            try {
                value = new BigDecimal(node.asText().replaceAll("[$,\\s]|MXN|mxn", ""));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return value.signum() < 0 ? null : value;
    }

    private static Integer wholeNumber(JsonNode node) {
        BigDecimal value = amount(node);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }
}

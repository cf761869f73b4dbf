package com.demoAuto.salesAgent.orchestrator.model;

import java.util.Locale;

/**
 * Closed set of things a customer message can ask for.
 */
public enum Intent {
    GENERAL,
    CATALOG_SEARCH,
    FINANCE_CALCULATION;

    /**
     * Exact, case-insensitive match of a classifier label after trimming.
     * Anything else, including null or blank, is {@link #GENERAL}.
     */
    public static Intent fromLabel(String label) {
        if (label == null) {
            return GENERAL;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (Intent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return GENERAL;
    }
}

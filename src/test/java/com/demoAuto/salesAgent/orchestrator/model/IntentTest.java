package com.demoAuto.salesAgent.orchestrator.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class IntentTest {

    @Test
    void labelsAreTrimmedAndUppercased() {
        assertEquals(Intent.CATALOG_SEARCH, Intent.fromLabel("  catalog_search\n"));
        assertEquals(Intent.FINANCE_CALCULATION, Intent.fromLabel("FINANCE_CALCULATION"));
        assertEquals(Intent.GENERAL, Intent.fromLabel("General"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"MAYBE", "CATALOG", "FINANCE_CALCULATION.", "CATALOG_SEARCH or GENERAL"})
    void anythingElseIsGeneral(String label) {
        assertEquals(Intent.GENERAL, Intent.fromLabel(label));
    }
}

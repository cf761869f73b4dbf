package com.demoAuto.salesAgent.orchestrator.service;

import com.demoAuto.salesAgent.orchestrator.handler.CatalogHandler;
import com.demoAuto.salesAgent.orchestrator.handler.FinanceHandler;
import com.demoAuto.salesAgent.orchestrator.handler.GeneralHandler;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IntentRouterTest {

    private GeneralHandler general;
    private CatalogHandler catalog;
    private FinanceHandler finance;

    @BeforeEach
    void setUp() {
        general = mock(GeneralHandler.class);
        catalog = mock(CatalogHandler.class);
        finance = mock(FinanceHandler.class);
        when(general.intent()).thenReturn(Intent.GENERAL);
        when(catalog.intent()).thenReturn(Intent.CATALOG_SEARCH);
        when(finance.intent()).thenReturn(Intent.FINANCE_CALCULATION);
    }

    @Test
    void everyIntentRoutesToItsHandler() {
        IntentRouter router = new IntentRouter(List.of(finance, general, catalog));

        assertSame(general, router.route(Intent.GENERAL));
        assertSame(catalog, router.route(Intent.CATALOG_SEARCH));
        assertSame(finance, router.route(Intent.FINANCE_CALCULATION));
    }

    @Test
    void nullIntentRoutesToGeneral() {
        IntentRouter router = new IntentRouter(List.of(general, catalog, finance));

        assertSame(general, router.route(null));
    }

    @Test
    void missingHandlerFailsAtConstruction() {
        assertThrows(IllegalStateException.class, () -> new IntentRouter(List.of(general, catalog)));
    }

    @Test
    void duplicateHandlerFailsAtConstruction() {
        CatalogHandler second = mock(CatalogHandler.class);
        when(second.intent()).thenReturn(Intent.CATALOG_SEARCH);

        assertThrows(IllegalStateException.class, () -> new IntentRouter(List.of(general, catalog, second, finance)));
    }
}

package com.demoAuto.salesAgent.catalog.controller;

import com.demoAuto.salesAgent.catalog.CatalogFixtures;
import com.demoAuto.salesAgent.catalog.model.CatalogStats;
import com.demoAuto.salesAgent.catalog.model.CustomerPreferences;
import com.demoAuto.salesAgent.catalog.model.RecommendationResult;
import com.demoAuto.salesAgent.catalog.model.ScoredVehicle;
import com.demoAuto.salesAgent.catalog.service.CarSearchService;
import com.demoAuto.salesAgent.catalog.service.RecommendationService;
import com.demoAuto.salesAgent.catalog.store.CatalogStore;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = CatalogController.class)
class CatalogControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private CatalogStore catalogStore;

    @MockBean
    private CarSearchService carSearchService;

    @MockBean
    private RecommendationService recommendationService;

    @Test
    void recommendationsUseRequestPreferences() throws Exception {
        when(recommendationService.recommend(any(CustomerPreferences.class), eq(2))).thenReturn(RecommendationResult.builder()
                .recommendations(List.of(new ScoredVehicle(CatalogFixtures.civic(), 0.8)))
                .totalMatches(1)
                .rationale("Found 1 cars within your budget of $350,000")
                .build());

        mvc.perform(post("/api/v1/catalog/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxPrice\": 350000, \"preferredMakes\": [\"Honda\"], \"limit\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalMatches").value(1))
                .andExpect(jsonPath("$.recommendations[0].vehicle.stockId").value("100"))
                .andExpect(jsonPath("$.rationale").value("Found 1 cars within your budget of $350,000"));

        ArgumentCaptor<CustomerPreferences> captor = ArgumentCaptor.forClass(CustomerPreferences.class);
        verify(recommendationService).recommend(captor.capture(), eq(2));
        assertEquals(0, new BigDecimal("350000").compareTo(captor.getValue().getMaxPrice()));
        assertEquals(Set.of("Honda"), captor.getValue().getPreferredMakes());
    }

    @Test
    void invertedPriceRangeIsBadRequest() throws Exception {
        mvc.perform(post("/api/v1/catalog/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minPrice\": 300000, \"maxPrice\": 200000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        verifyNoInteractions(recommendationService);
    }

    @Test
    void limitOutOfRangeIsBadRequest() throws Exception {
        mvc.perform(post("/api/v1/catalog/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limit\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void searchReturnsScoredVehicles() throws Exception {
        when(carSearchService.search("corolla")).thenReturn(List.of(new ScoredVehicle(CatalogFixtures.corolla(), 1.0)));

        mvc.perform(get("/api/v1/catalog/search").param("q", "corolla"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].vehicle.model").value("Corolla"))
                .andExpect(jsonPath("$[0].score").value(1.0));
    }

    @Test
    void similarForUnknownStockIdIsNotFound() throws Exception {
        when(catalogStore.byStockId("999")).thenReturn(Optional.empty());

        mvc.perform(get("/api/v1/catalog/vehicles/999/similar"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("VEHICLE_NOT_FOUND"));
    }

    @Test
    void similarUsesDefaultLimit() throws Exception {
        when(catalogStore.byStockId("100")).thenReturn(Optional.of(CatalogFixtures.civic()));
        when(recommendationService.findSimilar(CatalogFixtures.civic(), 3))
                .thenReturn(List.of(new ScoredVehicle(CatalogFixtures.corolla(), 0.7)));

        mvc.perform(get("/api/v1/catalog/vehicles/100/similar"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].vehicle.stockId").value("200"));
    }

    @Test
    void statsAreReturned() throws Exception {
        when(catalogStore.stats()).thenReturn(CatalogStats.builder()
                .totalVehicles(3)
                .makes(List.of("Honda", "Toyota", "Volkswagen"))
                .minPrice(new BigDecimal("280000"))
                .maxPrice(new BigDecimal("320000"))
                .minYear(2019)
                .maxYear(2021)
                .build());

        mvc.perform(get("/api/v1/catalog/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalVehicles").value(3))
                .andExpect(jsonPath("$.makes[2]").value("Volkswagen"));
    }
}

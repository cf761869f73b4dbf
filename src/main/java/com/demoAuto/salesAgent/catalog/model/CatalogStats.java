package com.demoAuto.salesAgent.catalog.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class CatalogStats {

    int totalVehicles;
    List<String> makes;
    BigDecimal minPrice;
    BigDecimal maxPrice;
    Integer minYear;
    Integer maxYear;
}

package com.demoAuto.salesAgent.orchestrator.model;

import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.finance.model.FinancingPlan;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Reply text plus the structured data a handler produced along the way.
 */
@Value
@Builder
public class HandlerResponse {

    String text;

    @Builder.Default
    List<VehicleRecord> cars = List.of();

    /**
     * Set only when a plan was actually calculated.
     */
    FinancingPlan financingPlan;

    public static HandlerResponse text(String text) {
        return HandlerResponse.builder().text(text).build();
    }
}

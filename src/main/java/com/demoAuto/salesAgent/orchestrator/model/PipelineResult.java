package com.demoAuto.salesAgent.orchestrator.model;

import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.finance.model.FinancingPlan;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Final output of one pipeline run.
 */
@Value
@Builder
public class PipelineResult {

    String text;
    Intent intent;

    @Builder.Default
    List<VehicleRecord> cars = List.of();

    FinancingPlan financingPlan;
    String correlationId;
}

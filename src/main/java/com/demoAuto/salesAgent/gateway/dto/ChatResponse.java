package com.demoAuto.salesAgent.gateway.dto;

import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.finance.model.FinancingPlan;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for chat messages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatResponse {

    private String answer;
    private Intent intent;
    private String correlationId;

    /**
     * Cars the reply is based on; empty when the reply did not involve the catalog.
     */
    private List<VehicleRecord> cars;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private FinancingPlan financingPlan;
}

package com.demoAuto.salesAgent.orchestrator.model;

/**
 * Stages of one pipeline run, in the only order they may be visited.
 */
public enum PipelineStage {
    START,
    CLASSIFIED,
    DISPATCHED,
    FORMATTED,
    DONE
}

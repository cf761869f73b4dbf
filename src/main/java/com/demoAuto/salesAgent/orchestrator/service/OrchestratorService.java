package com.demoAuto.salesAgent.orchestrator.service;

import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.conversation.model.Conversation;
import com.demoAuto.salesAgent.gateway.model.RequestContext;
import com.demoAuto.salesAgent.gateway.service.CorrelationIdService;
import com.demoAuto.salesAgent.gateway.util.UserIdMasker;
import com.demoAuto.salesAgent.orchestrator.classifier.IntentClassifier;
import com.demoAuto.salesAgent.orchestrator.handler.IntentHandler;
import com.demoAuto.salesAgent.orchestrator.model.HandlerRequest;
import com.demoAuto.salesAgent.orchestrator.model.HandlerResponse;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import com.demoAuto.salesAgent.orchestrator.model.PipelineResult;
import com.demoAuto.salesAgent.orchestrator.model.PipelineStage;
import com.demoAuto.salesAgent.orchestrator.model.PipelineState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Orchestrator service - runs one customer message through the pipeline.
 *
 * Workflow steps:
 * START -> CLASSIFY -> DISPATCH (intent handler) -> FORMAT -> DONE
 *
 * The conversation is only read here; appending the finished turn is the caller's job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestratorService {

    static final String ERROR_MESSAGE = "Sorry, something went wrong while processing your message. Please try again.";

    private final IntentClassifier intentClassifier;
    private final IntentRouter intentRouter;
    private final CorrelationIdService correlationIdService;
    private final SalesAgentProperties properties;

    /**
     * Entry point for callers without a request context; a correlation id is generated.
     */
    public PipelineResult process(String userId, String message, Conversation conversation) {
        RequestContext requestContext = RequestContext.builder()
                .userId(userId)
                .correlationId(correlationIdService.generateCorrelationId())
                .messageText(message)
                .receivedAt(Instant.now())
                .build();
        return process(requestContext, conversation);
    }

    public PipelineResult process(RequestContext requestContext, Conversation conversation) {
        String correlationId = requestContext.getCorrelationId();
        log.info("Starting pipeline - correlationId: {}, userId: {}",
                correlationId, UserIdMasker.mask(requestContext.getUserId()));

        String history = conversation == null ? "" : conversation.historyText(properties.getHistoryTurns());
        PipelineState state = new PipelineState(requestContext, history);

        try {
            classify(state);
            dispatch(state);
            format(state);
            state.advanceTo(PipelineStage.DONE);
            log.info("Pipeline completed - correlationId: {}, intent: {}", correlationId, state.getIntent());
            return state.getResult();
        } catch (Exception e) {
            log.error("Error in pipeline - correlationId: {}, stage: {}", correlationId, state.getStage(), e);
            return PipelineResult.builder()
                    .text(ERROR_MESSAGE)
                    .intent(state.getIntent() == null ? Intent.GENERAL : state.getIntent())
                    .correlationId(correlationId)
                    .build();
        }
    }

    private void classify(PipelineState state) {
        log.debug("Step CLASSIFY - correlationId: {}", state.getCorrelationId());
        Intent intent = intentClassifier.classify(state.getMessageText(), state.getHistory());
        state.setIntent(intent == null ? Intent.GENERAL : intent);
        state.advanceTo(PipelineStage.CLASSIFIED);
        log.info("Intent classified - correlationId: {}, intent: {}", state.getCorrelationId(), state.getIntent());
    }

    private void dispatch(PipelineState state) {
        log.debug("Step DISPATCH - correlationId: {}", state.getCorrelationId());
        IntentHandler handler = intentRouter.route(state.getIntent());
        HandlerResponse response = handler.handle(HandlerRequest.builder()
                .query(state.getMessageText())
                .history(state.getHistory())
                .correlationId(state.getCorrelationId())
                .build());
        state.setHandlerResponse(response);
        state.advanceTo(PipelineStage.DISPATCHED);
    }

    private void format(PipelineState state) {
        log.debug("Step FORMAT - correlationId: {}", state.getCorrelationId());
        HandlerResponse response = state.getHandlerResponse();
        state.setResult(PipelineResult.builder()
                .text(response.getText())
                .intent(state.getIntent())
                .cars(response.getCars() == null ? List.of() : response.getCars())
                .financingPlan(response.getFinancingPlan())
                .correlationId(state.getCorrelationId())
                .build());
        state.advanceTo(PipelineStage.FORMATTED);
    }
}

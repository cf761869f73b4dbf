package com.demoAuto.salesAgent.gateway.service;

import com.demoAuto.salesAgent.conversation.service.ConversationStore;
import com.demoAuto.salesAgent.gateway.dto.ChatRequest;
import com.demoAuto.salesAgent.gateway.dto.ChatResponse;
import com.demoAuto.salesAgent.gateway.exception.MissingUserIdException;
import com.demoAuto.salesAgent.gateway.model.RequestContext;
import com.demoAuto.salesAgent.gateway.util.UserIdMasker;
import com.demoAuto.salesAgent.orchestrator.model.PipelineResult;
import com.demoAuto.salesAgent.orchestrator.service.OrchestratorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Gateway service - business logic for chat requests.
 *
 * Responsibilities:
 * - Validate the userId header
 * - Generate the correlationId and build the RequestContext
 * - Run the pipeline and append the turn while holding the user's conversation
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatGatewayService {

    private final CorrelationIdService correlationIdService;
    private final ConversationStore conversationStore;
    private final OrchestratorService orchestratorService;

    public ChatResponse processChatRequest(ChatRequest request, String userIdHeader) {
        String userId = requireUserId(userIdHeader);
        String correlationId = correlationIdService.generateCorrelationId();

        log.info("Received chat request - correlationId: {}, userId: {}, messageLength: {}",
                correlationId, UserIdMasker.mask(userId), request.getMessage().length());

        RequestContext requestContext = RequestContext.builder()
                .userId(userId)
                .correlationId(correlationId)
                .messageText(request.getMessage())
                .receivedAt(Instant.now())
                .build();

        PipelineResult result = conversationStore.withConversation(userId, conversation -> {
            PipelineResult processed = orchestratorService.process(requestContext, conversation);
            conversation.append(request.getMessage(), processed.getText());
            return processed;
        });

        log.info("Chat request completed - correlationId: {}, intent: {}", correlationId, result.getIntent());

        return ChatResponse.builder()
                .answer(result.getText())
                .intent(result.getIntent())
                .correlationId(correlationId)
                .cars(result.getCars())
                .financingPlan(result.getFinancingPlan())
                .build();
    }

    public void resetConversation(String userIdHeader) {
        String userId = requireUserId(userIdHeader);
        conversationStore.reset(userId);
    }

    private String requireUserId(String userIdHeader) {
        if (userIdHeader == null || userIdHeader.isBlank()) {
            log.warn("Missing or blank X-User-ID header");
            throw new MissingUserIdException("X-User-ID header is required");
        }
        return userIdHeader.trim();
    }
}

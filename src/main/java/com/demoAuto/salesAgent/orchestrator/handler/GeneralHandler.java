package com.demoAuto.salesAgent.orchestrator.handler;

import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.knowledge.model.KnowledgeSection;
import com.demoAuto.salesAgent.llm.model.ChatMessage;
import com.demoAuto.salesAgent.llm.service.TextGeneration;
import com.demoAuto.salesAgent.orchestrator.model.HandlerRequest;
import com.demoAuto.salesAgent.orchestrator.model.HandlerResponse;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import com.demoAuto.salesAgent.orchestrator.prompt.GeneralAnswerPrompt;
import com.demoAuto.salesAgent.retrieval.Retrieval;
import com.demoAuto.salesAgent.retrieval.ScoredItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Answers questions about the company from the knowledge base.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class GeneralHandler implements IntentHandler {

    static final String FALLBACK = "Sorry, could you rephrase your question?";

    private final TextGeneration textGeneration;
    private final Retrieval<KnowledgeSection> knowledgeBase;
    private final SalesAgentProperties properties;

    @Override
    public Intent intent() {
        return Intent.GENERAL;
    }

    @Override
    public HandlerResponse handle(HandlerRequest request) {
        String correlationId = request.getCorrelationId();
        String context = retrieveContext(request.getQuery(), correlationId);

        try {
            String answer = textGeneration.complete(List.of(
                    ChatMessage.system(GeneralAnswerPrompt.systemPrompt(context)),
                    ChatMessage.user(request.userContent())));
            log.info("General answer generated - correlationId: {}", correlationId);
            return HandlerResponse.text(answer);
        } catch (RuntimeException e) {
            log.warn("General answer generation failed - correlationId: {}, error: {}", correlationId, e.getMessage());
            return HandlerResponse.text(FALLBACK);
        }
    }

    private String retrieveContext(String query, String correlationId) {
        try {
            List<ScoredItem<KnowledgeSection>> sections = knowledgeBase.topK(query, properties.getKnowledge().getTopK());
            log.debug("Knowledge sections retrieved - correlationId: {}, sections: {}", correlationId, sections.size());
            return sections.stream()
                    .map(scored -> scored.item().text())
                    .collect(Collectors.joining("\n\n"));
        } catch (RuntimeException e) {
            log.warn("Knowledge retrieval failed, answering without grounding - correlationId: {}, error: {}",
                    correlationId, e.getMessage());
            return "";
        }
    }
}

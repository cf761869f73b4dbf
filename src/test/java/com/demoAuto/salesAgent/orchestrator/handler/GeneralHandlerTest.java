package com.demoAuto.salesAgent.orchestrator.handler;

import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.knowledge.model.KnowledgeSection;
import com.demoAuto.salesAgent.llm.model.ChatMessage;
import com.demoAuto.salesAgent.llm.service.GenerationUnavailableException;
import com.demoAuto.salesAgent.llm.service.TextGeneration;
import com.demoAuto.salesAgent.orchestrator.model.HandlerRequest;
import com.demoAuto.salesAgent.orchestrator.model.HandlerResponse;
import com.demoAuto.salesAgent.orchestrator.prompt.GeneralAnswerPrompt;
import com.demoAuto.salesAgent.retrieval.Retrieval;
import com.demoAuto.salesAgent.retrieval.RetrievalUnavailableException;
import com.demoAuto.salesAgent.retrieval.ScoredItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeneralHandlerTest {

    @Mock
    private TextGeneration textGeneration;

    @Mock
    private Retrieval<KnowledgeSection> knowledgeBase;

    private GeneralHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GeneralHandler(textGeneration, knowledgeBase, new SalesAgentProperties());
    }

    @Test
    @SuppressWarnings("unchecked")
    void answerIsGroundedInRetrievedSections() {
        when(knowledgeBase.topK("warranty?", 3)).thenReturn(List.of(
                new ScoredItem<>(new KnowledgeSection("Warranty", "Every car has a 3 month warranty."), 0.9)));
        when(textGeneration.complete(anyList())).thenReturn("All cars carry a 3 month warranty.");

        HandlerResponse response = handler.handle(HandlerRequest.builder()
                .query("warranty?").history("U: hi\nA: hello").correlationId("corr-1").build());

        assertEquals("All cars carry a 3 month warranty.", response.getText());
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(textGeneration).complete(captor.capture());
        assertTrue(captor.getValue().get(0).getContent().contains("Every car has a 3 month warranty."));
        assertEquals("History:\nU: hi\nA: hello\n\nQuery: warranty?", captor.getValue().get(1).getContent());
    }

    @Test
    @SuppressWarnings("unchecked")
    void retrievalFailureStillAnswers() {
        when(knowledgeBase.topK(anyString(), anyInt())).thenThrow(new RetrievalUnavailableException("no index"));
        when(textGeneration.complete(anyList())).thenReturn("I do not have that information.");

        HandlerResponse response = handler.handle(HandlerRequest.builder()
                .query("where are you?").history("").correlationId("corr-1").build());

        assertEquals("I do not have that information.", response.getText());
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(textGeneration).complete(captor.capture());
        assertTrue(captor.getValue().get(0).getContent().contains(GeneralAnswerPrompt.NO_CONTEXT));
        assertEquals("where are you?", captor.getValue().get(1).getContent());
    }

    @Test
    void generationFailureReturnsFallback() {
        when(knowledgeBase.topK(anyString(), anyInt())).thenReturn(List.of());
        when(textGeneration.complete(anyList())).thenThrow(new GenerationUnavailableException("down"));

        HandlerResponse response = handler.handle(HandlerRequest.builder()
                .query("hours?").history("").correlationId("corr-1").build());

        assertEquals(GeneralHandler.FALLBACK, response.getText());
        assertTrue(response.getCars().isEmpty());
        assertNull(response.getFinancingPlan());
    }
}

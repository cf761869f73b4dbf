package com.demoAuto.salesAgent.gateway.service;

import com.demoAuto.salesAgent.conversation.model.Conversation;
import com.demoAuto.salesAgent.conversation.service.InMemoryConversationStore;
import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.gateway.dto.ChatRequest;
import com.demoAuto.salesAgent.gateway.dto.ChatResponse;
import com.demoAuto.salesAgent.gateway.exception.MissingUserIdException;
import com.demoAuto.salesAgent.gateway.model.RequestContext;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import com.demoAuto.salesAgent.orchestrator.model.PipelineResult;
import com.demoAuto.salesAgent.orchestrator.service.OrchestratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatGatewayServiceTest {

    @Mock
    private CorrelationIdService correlationIdService;

    @Mock
    private OrchestratorService orchestratorService;

    private InMemoryConversationStore conversationStore;
    private ChatGatewayService chatGatewayService;

    @BeforeEach
    void setUp() {
        conversationStore = new InMemoryConversationStore(new SalesAgentProperties());
        chatGatewayService = new ChatGatewayService(correlationIdService, conversationStore, orchestratorService);
    }

    @Test
    void turnIsAppendedAfterPipelineRuns() {
        when(correlationIdService.generateCorrelationId()).thenReturn("corr-1");
        when(orchestratorService.process(any(RequestContext.class), any(Conversation.class)))
                .thenReturn(PipelineResult.builder().text("Hello!").intent(Intent.GENERAL).correlationId("corr-1").build());

        ChatResponse response = chatGatewayService.processChatRequest(new ChatRequest("hi"), " user-1 ");

        assertEquals("Hello!", response.getAnswer());
        assertEquals(Intent.GENERAL, response.getIntent());
        assertEquals("corr-1", response.getCorrelationId());
        assertTrue(response.getCars().isEmpty());

        ArgumentCaptor<RequestContext> captor = ArgumentCaptor.forClass(RequestContext.class);
        verify(orchestratorService).process(captor.capture(), any(Conversation.class));
        assertEquals("user-1", captor.getValue().getUserId());
        assertEquals("hi", captor.getValue().getMessageText());

        String history = conversationStore.withConversation("user-1", conversation -> conversation.historyText(3));
        assertEquals("U: hi\nA: Hello!", history);
    }

    @Test
    void blankUserIdIsRejected() {
        assertThrows(MissingUserIdException.class,
                () -> chatGatewayService.processChatRequest(new ChatRequest("hi"), "  "));
        assertThrows(MissingUserIdException.class,
                () -> chatGatewayService.processChatRequest(new ChatRequest("hi"), null));
        verifyNoInteractions(orchestratorService);
    }

    @Test
    void resetStartsFreshConversation() {
        conversationStore.withConversation("user-1", conversation -> {
            conversation.append("hi", "hello");
            return null;
        });

        chatGatewayService.resetConversation("user-1");

        int size = conversationStore.withConversation("user-1", Conversation::size);
        assertEquals(0, size);
    }
}

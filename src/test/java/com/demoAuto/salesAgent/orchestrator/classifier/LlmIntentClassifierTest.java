package com.demoAuto.salesAgent.orchestrator.classifier;

import com.demoAuto.salesAgent.llm.model.ChatMessage;
import com.demoAuto.salesAgent.llm.service.GenerationUnavailableException;
import com.demoAuto.salesAgent.llm.service.TextGeneration;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmIntentClassifierTest {

    @Mock
    private TextGeneration textGeneration;

    @InjectMocks
    private LlmIntentClassifier classifier;

    @Test
    void validLabelIsReturned() {
        when(textGeneration.complete(anyList())).thenReturn(" finance_calculation ");

        assertEquals(Intent.FINANCE_CALCULATION, classifier.classify("how much per month?", ""));
    }

    @Test
    void unknownLabelFallsBackToGeneral() {
        when(textGeneration.complete(anyList())).thenReturn("MAYBE");

        assertEquals(Intent.GENERAL, classifier.classify("hmm", ""));
    }

    @Test
    void generationFailureFallsBackToGeneral() {
        when(textGeneration.complete(anyList())).thenThrow(new GenerationUnavailableException("down"));

        assertEquals(Intent.GENERAL, classifier.classify("I want a Civic", ""));
    }

    @Test
    @SuppressWarnings("unchecked")
    void historyIsIncludedInPrompt() {
        when(textGeneration.complete(anyList())).thenReturn("CATALOG_SEARCH");

        classifier.classify("and in red?", "U: any civic?\nA: yes");

        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(textGeneration).complete(captor.capture());
        List<ChatMessage> messages = captor.getValue();
        assertEquals(ChatMessage.ROLE_SYSTEM, messages.get(0).getRole());
        assertTrue(messages.get(1).getContent().contains("U: any civic?"));
        assertTrue(messages.get(1).getContent().contains("and in red?"));
    }
}

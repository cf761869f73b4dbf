package com.demoAuto.salesAgent.orchestrator.classifier;

import com.demoAuto.salesAgent.llm.model.ChatMessage;
import com.demoAuto.salesAgent.llm.service.TextGeneration;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import com.demoAuto.salesAgent.orchestrator.prompt.IntentClassificationPrompt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Intent classifier backed by a single text-generation call restricted to the three labels.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmIntentClassifier implements IntentClassifier {

    private final TextGeneration textGeneration;

    @Override
    public Intent classify(String query, String history) {
        String raw;
        try {
            raw = textGeneration.complete(List.of(
                    ChatMessage.system(IntentClassificationPrompt.SYSTEM_PROMPT),
                    ChatMessage.user(IntentClassificationPrompt.userPrompt(query, history))));
        } catch (RuntimeException e) {
            log.warn("Intent classification failed, defaulting to GENERAL - error: {}", e.getMessage());
            return Intent.GENERAL;
        }

        Intent intent = Intent.fromLabel(raw);
        if (intent == Intent.GENERAL && !Intent.GENERAL.name().equalsIgnoreCase(raw == null ? "" : raw.trim())) {
            log.info("Unrecognized intent label, defaulting to GENERAL - label: {}", raw);
        }
        return intent;
    }
}

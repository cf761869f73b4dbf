package com.demoAuto.salesAgent.llm.service;

import com.demoAuto.salesAgent.llm.model.ChatMessage;

import java.util.List;

/**
 * Text generation capability used for intent classification, parameter extraction
 * and response drafting.
 */
public interface TextGeneration {

    /**
     * Returns the completion for an ordered list of role-tagged messages.
     *
     * @param messages conversation sent to the model, system message first
     * @return non-blank completion text
     * @throws GenerationUnavailableException on transport failure, missing configuration
     *         or an empty completion
     */
    String complete(List<ChatMessage> messages);
}

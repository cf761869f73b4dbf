package com.demoAuto.salesAgent.orchestrator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Input handed to an intent handler.
 */
@Value
@Builder
public class HandlerRequest {

    String query;

    /**
     * Recent turns rendered as text; empty for a new conversation.
     */
    String history;

    String correlationId;

    public boolean hasHistory() {
        return history != null && !history.isBlank();
    }

    /**
     * User message content for a generation call: the query, prefixed by the history when there is one.
     */
    public String userContent() {
        return hasHistory() ? "History:\n" + history + "\n\nQuery: " + query : query;
    }
}

package com.demoAuto.salesAgent.conversation.model;

import lombok.Value;

import java.time.Instant;

/**
 * One user message and the assistant reply it received.
 */
@Value
public class ConversationTurn {

    String userText;

    /**
     * Null when the turn never got a reply.
     */
    String assistantText;

    Instant createdAt;
}

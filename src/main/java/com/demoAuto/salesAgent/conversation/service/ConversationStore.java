package com.demoAuto.salesAgent.conversation.service;

import com.demoAuto.salesAgent.conversation.model.Conversation;

import java.util.function.Function;

/**
 * Per-user conversation storage.
 *
 * {@link #withConversation} is the only way to read or append: the callback runs while the
 * user's lock is held, so two requests for the same user are serialized and neither loses
 * the other's turn. Different users never wait on each other.
 */
public interface ConversationStore {

    /**
     * Runs {@code action} against the user's conversation, creating it if needed.
     * The conversation must not escape the callback.
     */
    <T> T withConversation(String userId, Function<Conversation, T> action);

    /**
     * Drops the user's conversation; the next message starts a new one.
     */
    void reset(String userId);

    long activeConversations();
}

package com.demoAuto.salesAgent.conversation.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turn history of one user, append-only.
 *
 * Not thread-safe on its own; the {@link com.demoAuto.salesAgent.conversation.service.ConversationStore}
 * hands it out only while holding that user's lock.
 */
public class Conversation {

    @Getter
    private final String userId;

    @Getter
    private final Instant createdAt;

    private final List<ConversationTurn> turns = new ArrayList<>();

    public Conversation(String userId) {
        this.userId = userId;
        this.createdAt = Instant.now();
    }

    public void append(String userText, String assistantText) {
        turns.add(new ConversationTurn(userText, assistantText, Instant.now()));
    }

    /**
     * The last {@code n} turns, oldest first, as an immutable copy.
     */
    public List<ConversationTurn> recentTurns(int n) {
        if (n <= 0) {
            return List.of();
        }
        int from = Math.max(0, turns.size() - n);
        return List.copyOf(turns.subList(from, turns.size()));
    }

    /**
     * The last {@code n} turns rendered as {@code U: ...\nA: ...} lines, or an empty string.
     */
    public String historyText(int n) {
        return recentTurns(n).stream()
                .map(turn -> "U: " + turn.getUserText() + "\nA: "
                        + (turn.getAssistantText() == null ? "" : turn.getAssistantText()))
                .collect(Collectors.joining("\n"));
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }
}

package com.demoAuto.salesAgent.conversation.service;

import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.conversation.model.Conversation;
import com.demoAuto.salesAgent.gateway.util.UserIdMasker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Conversation store backed by a Caffeine cache.
 *
 * Responsibilities:
 * - Get or create the conversation for a user
 * - Serialize access per user
 * - Expire idle conversations and bound the number kept in memory
 *
 * User locks are held apart from the conversation cache, so evicting a conversation never
 * releases its user's lock. A lock lives as long as some thread references it.
 * Nothing is persisted; conversations live for the process lifetime at most.
 */
@Slf4j
@Service
public class InMemoryConversationStore implements ConversationStore {

    private final Cache<String, Conversation> conversations;

    private final LoadingCache<String, ReentrantLock> userLocks = Caffeine.newBuilder()
            .weakValues()
            .build(userId -> new ReentrantLock());

    @Autowired
    public InMemoryConversationStore(SalesAgentProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    InMemoryConversationStore(SalesAgentProperties properties, Ticker ticker) {
        SalesAgentProperties.ConversationSettings settings = properties.getConversation();
        this.conversations = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfterAccess(settings.getIdleTtl())
                .maximumSize(settings.getMaxUsers())
                .removalListener((String key, Conversation value, RemovalCause cause) ->
                        log.debug("Conversation removed - userId: {}, cause: {}", UserIdMasker.mask(key), cause))
                .build();
    }

    @Override
    public <T> T withConversation(String userId, Function<Conversation, T> action) {
        ReentrantLock lock = userLocks.get(userId);
        lock.lock();
        try {
            Conversation conversation = conversations.get(userId, id -> {
                log.info("Created new conversation - userId: {}", UserIdMasker.mask(id));
                return new Conversation(id);
            });
            T result = action.apply(conversation);
            // expiry or size eviction may have dropped it while the action ran
            if (conversations.asMap().putIfAbsent(userId, conversation) == null) {
                log.debug("Conversation restored after eviction - userId: {}", UserIdMasker.mask(userId));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset(String userId) {
        ReentrantLock lock = userLocks.get(userId);
        lock.lock();
        try {
            conversations.invalidate(userId);
        } finally {
            lock.unlock();
        }
        log.info("Conversation reset - userId: {}", UserIdMasker.mask(userId));
    }

    @Override
    public long activeConversations() {
        conversations.cleanUp();
        return conversations.estimatedSize();
    }
}

package com.demoAuto.salesAgent.orchestrator.service;

import com.demoAuto.salesAgent.orchestrator.handler.IntentHandler;
import com.demoAuto.salesAgent.orchestrator.model.Intent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table from intent to handler, checked at startup to cover every intent exactly once.
 */
@Slf4j
@Component
public class IntentRouter {

    private final Map<Intent, IntentHandler> handlers = new EnumMap<>(Intent.class);

    public IntentRouter(List<IntentHandler> handlers) {
        for (IntentHandler handler : handlers) {
            IntentHandler previous = this.handlers.put(handler.intent(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for intent " + handler.intent());
            }
        }
        for (Intent intent : Intent.values()) {
            if (!this.handlers.containsKey(intent)) {
                throw new IllegalStateException("No handler registered for intent " + intent);
            }
        }
    }

    /**
     * Handler for {@code intent}; a null intent gets the GENERAL handler.
     */
    public IntentHandler route(Intent intent) {
        IntentHandler handler = intent == null ? null : handlers.get(intent);
        if (handler == null) {
            log.warn("No handler for intent {}, using GENERAL", intent);
            return handlers.get(Intent.GENERAL);
        }
        return handler;
    }
}

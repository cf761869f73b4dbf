package com.demoAuto.salesAgent.orchestrator.classifier;

import com.demoAuto.salesAgent.orchestrator.model.Intent;

/**
 * Maps a customer message to an {@link Intent}.
 *
 * Implementations must never throw: an ambiguous message or a failing backend
 * resolves to {@link Intent#GENERAL}.
 */
public interface IntentClassifier {

    Intent classify(String query, String history);
}

package com.demoAuto.salesAgent.llm.service;

/**
 * Turns text into an embedding vector for semantic retrieval.
 */
public interface EmbeddingClient {

    /**
     * @throws EmbeddingUnavailableException when no vector can be produced
     */
    float[] embed(String text);
}

package com.demoAuto.salesAgent.llm.service;

/**
 * Exception thrown when the embedding backend cannot produce a vector.
 */
public class EmbeddingUnavailableException extends RuntimeException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.demoAuto.salesAgent.llm.service;

/**
 * Exception thrown when the text generation backend cannot produce a completion.
 */
public class GenerationUnavailableException extends RuntimeException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

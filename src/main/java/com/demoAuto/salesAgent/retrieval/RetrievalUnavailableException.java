package com.demoAuto.salesAgent.retrieval;

/**
 * Exception thrown when a semantic index cannot answer a query.
 */
public class RetrievalUnavailableException extends RuntimeException {

    public RetrievalUnavailableException(String message) {
        super(message);
    }

    public RetrievalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

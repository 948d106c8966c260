package com.drivekb.error;

/**
 * Root of the retrieval core's failures. Every subclass names the operation that failed so the
 * caller can log it without inspecting the cause chain.
 */
public class KnowledgeBaseException extends RuntimeException {
    private final String operation;

    public KnowledgeBaseException(String operation, String message) {
        this(operation, message, null);
    }

    public KnowledgeBaseException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}

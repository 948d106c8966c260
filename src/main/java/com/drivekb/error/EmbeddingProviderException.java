package com.drivekb.error;

public class EmbeddingProviderException extends KnowledgeBaseException {
    private final boolean transientFailure;

    public EmbeddingProviderException(String operation, String message, boolean transientFailure) {
        this(operation, message, transientFailure, null);
    }

    public EmbeddingProviderException(String operation, String message, boolean transientFailure, Throwable cause) {
        super(operation, message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * True for network errors, throttling and server-side failures that a later attempt may not hit.
     */
    public boolean transientFailure() {
        return transientFailure;
    }
}

package com.drivekb.error;

public class VectorStoreException extends KnowledgeBaseException {
    private final int statusCode;

    public VectorStoreException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
        this.statusCode = -1;
    }

    public VectorStoreException(String operation, int statusCode, String body) {
        super(operation, "vector store returned HTTP " + statusCode + " body=" + body);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}

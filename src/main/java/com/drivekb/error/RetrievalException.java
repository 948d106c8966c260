package com.drivekb.error;

public class RetrievalException extends KnowledgeBaseException {
    public RetrievalException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}

package com.drivekb.error;

public class IndexBuildException extends KnowledgeBaseException {
    public IndexBuildException(String operation, String message) {
        super(operation, message);
    }

    public IndexBuildException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}

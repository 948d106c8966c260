package com.drivekb.error;

import com.drivekb.lifecycle.IndexState;

public class IndexNotReadyException extends KnowledgeBaseException {
    private final IndexState state;

    public IndexNotReadyException(String operation, IndexState state) {
        super(operation, "index is not ready (state=" + state + ")");
        this.state = state;
    }

    public IndexState state() {
        return state;
    }
}

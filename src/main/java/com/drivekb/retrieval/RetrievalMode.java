package com.drivekb.retrieval;

public enum RetrievalMode {
    HYBRID,
    VECTOR,
    KEYWORD
}

package com.drivekb.error;

import java.util.List;

public class ConfigurationException extends KnowledgeBaseException {
    private final List<String> errors;

    public ConfigurationException(String operation, List<String> errors) {
        super(operation, "invalid configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String operation, String error) {
        this(operation, List.of(error));
    }

    public List<String> errors() {
        return errors;
    }
}

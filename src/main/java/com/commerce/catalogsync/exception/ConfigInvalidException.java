package com.commerce.catalogsync.exception;

import java.util.List;

/**
 * Thrown before a run starts when the configuration is missing or malformed.
 */
public class ConfigInvalidException extends CatalogSyncException {

    private final List<String> problems;

    public ConfigInvalidException(String problem) {
        this(List.of(problem));
    }

    public ConfigInvalidException(List<String> problems) {
        super("Invalid catalog sync configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}

package com.acme.interop.bridge.catalog;

import java.util.List;

/**
 * The catalogue bindings or descriptor are malformed or disagree with each other.
 */
public final class CatalogException extends RuntimeException {
    private final List<String> problems;

    public CatalogException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public CatalogException(List<String> problems) {
        super("Catalogue mismatch: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}

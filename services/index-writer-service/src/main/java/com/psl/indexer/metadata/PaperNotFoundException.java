package com.psl.indexer.metadata;

public class PaperNotFoundException extends RuntimeException {
    private final String identifier;

    public PaperNotFoundException(String identifier) {
        super("paper not found upstream: " + identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}

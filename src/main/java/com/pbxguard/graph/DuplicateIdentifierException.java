package com.pbxguard.graph;

public class DuplicateIdentifierException extends Exception {
    private final String id;

    public DuplicateIdentifierException(String id) {
        super("Duplicate object identifier: " + id);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}

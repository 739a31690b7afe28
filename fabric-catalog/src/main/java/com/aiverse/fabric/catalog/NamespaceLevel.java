package com.aiverse.fabric.catalog;

/** Levels of the catalog namespace hierarchy, outermost first. */
public enum NamespaceLevel {
    ORGANIZATION("organization"),
    WORKSPACE("workspace"),
    PROJECT("project"),
    DATASET("dataset");

    private final String value;

    NamespaceLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}

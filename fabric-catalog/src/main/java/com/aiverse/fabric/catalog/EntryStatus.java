package com.aiverse.fabric.catalog;

public enum EntryStatus {
    ACTIVE,
    DEPRECATED,
    ARCHIVED
}

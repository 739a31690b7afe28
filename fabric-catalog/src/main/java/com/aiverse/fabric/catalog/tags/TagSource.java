package com.aiverse.fabric.catalog.tags;

public enum TagSource {
    MANUAL,
    AUTOMATED,
    INHERITED
}

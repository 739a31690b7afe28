package com.aiverse.fabric.catalog.tags;

import java.time.Instant;
import java.util.Objects;

/** A tag applied to a catalog entry. */
public record TagInstance(String key, String value, String appliedBy, Instant appliedAt, TagSource source) {

    public TagInstance {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        appliedBy = appliedBy != null ? appliedBy : "";
        appliedAt = appliedAt != null ? appliedAt : Instant.now();
        source = source != null ? source : TagSource.MANUAL;
    }
}

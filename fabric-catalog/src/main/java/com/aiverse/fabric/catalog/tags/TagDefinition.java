package com.aiverse.fabric.catalog.tags;

import java.util.List;
import java.util.Objects;

/**
 * Definition of a catalog tag.
 *
 * @param allowedValues permitted values; null means free-form
 */
public record TagDefinition(
        String key,
        TagCategory category,
        String description,
        List<String> allowedValues,
        boolean required,
        String defaultValue,
        GovernanceLevel governanceLevel) {

    public TagDefinition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(category, "category");
        description = description != null ? description : "";
        allowedValues = allowedValues != null ? List.copyOf(allowedValues) : null;
        governanceLevel = governanceLevel != null ? governanceLevel : GovernanceLevel.STANDARD;
        if (defaultValue != null && allowedValues != null && !allowedValues.contains(defaultValue)) {
            throw new IllegalArgumentException("Default value '" + defaultValue + "' not allowed for tag " + key);
        }
    }

    public boolean isFreeform() {
        return allowedValues == null;
    }

    public boolean validateValue(String value) {
        return allowedValues == null || allowedValues.contains(value);
    }
}

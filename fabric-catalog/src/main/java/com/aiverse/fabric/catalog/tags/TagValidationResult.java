package com.aiverse.fabric.catalog.tags;

import java.util.List;

/**
 * Outcome of {@link TagSchema#validateTags}. Errors make the tag set invalid; warnings (unknown tags) do not.
 */
public record TagValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public TagValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}

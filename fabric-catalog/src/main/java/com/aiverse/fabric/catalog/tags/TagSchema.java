package com.aiverse.fabric.catalog.tags;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tag governance schema: registered definitions and required keys. Not thread-safe for registration;
 * build it once, then share it for validation.
 */
public final class TagSchema {

    private final Map<String, TagDefinition> definitions = new LinkedHashMap<>();

    /** Registers or replaces the definition for its key. */
    public void registerTag(TagDefinition definition) {
        definitions.put(definition.key(), definition);
    }

    public Optional<TagDefinition> getDefinition(String key) {
        return Optional.ofNullable(definitions.get(key));
    }

    /**
     * Validates a tag set. A missing required tag and a value outside a definition's allowed values are errors;
     * a key with no definition is a warning.
     */
    public TagValidationResult validateTags(Map<String, String> tags) {
        Map<String, String> actual = tags != null ? tags : Map.of();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (String required : getRequiredTags()) {
            if (!actual.containsKey(required)) {
                errors.add("Missing required tag: " + required);
            }
        }
        for (Map.Entry<String, String> e : actual.entrySet()) {
            TagDefinition def = definitions.get(e.getKey());
            if (def == null) {
                warnings.add("Unknown tag: " + e.getKey());
            } else if (!def.validateValue(e.getValue())) {
                errors.add("Invalid value '" + e.getValue() + "' for tag '" + e.getKey() + "'. Allowed: " + def.allowedValues());
            }
        }
        return new TagValidationResult(errors.isEmpty(), errors, warnings);
    }

    /** Required tag keys in registration order. */
    public List<String> getRequiredTags() {
        List<String> out = new ArrayList<>();
        for (TagDefinition d : definitions.values()) {
            if (d.required()) out.add(d.key());
        }
        return out;
    }

    public List<TagDefinition> getTagsByCategory(TagCategory category) {
        List<TagDefinition> out = new ArrayList<>();
        for (TagDefinition d : definitions.values()) {
            if (d.category() == category) out.add(d);
        }
        return out;
    }

    public int size() {
        return definitions.size();
    }

    /** Schema holding {@link StandardTags#definitions()}. */
    public static TagSchema standard() {
        TagSchema schema = new TagSchema();
        StandardTags.definitions().forEach(schema::registerTag);
        return schema;
    }
}

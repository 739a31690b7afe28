package com.aiverse.fabric.catalog.tags;

import java.util.List;

/**
 * Standard tag definitions of the data fabric catalog. Required: data_classification, business_domain,
 * environment, owner_team.
 */
public final class StandardTags {

    public static final String DATA_CLASSIFICATION = "data_classification";
    public static final String BUSINESS_DOMAIN = "business_domain";
    public static final String DATA_QUALITY = "data_quality";
    public static final String ENVIRONMENT = "environment";
    public static final String COMPLIANCE_SCOPE = "compliance_scope";
    public static final String COST_CENTER = "cost_center";
    public static final String OWNER_TEAM = "owner_team";
    public static final String STORAGE_FORMAT = "storage_format";
    public static final String RETENTION_DAYS = "retention_days";

    private static final List<TagDefinition> DEFINITIONS = List.of(
            new TagDefinition(DATA_CLASSIFICATION, TagCategory.CLASSIFICATION, "Data sensitivity classification",
                    List.of("public", "internal", "confidential", "restricted", "pii", "phi"), true, null, GovernanceLevel.AUDIT),
            new TagDefinition(BUSINESS_DOMAIN, TagCategory.DOMAIN, "Business domain ownership",
                    List.of("finance", "hr", "sales", "marketing", "operations", "product", "engineering"), true, null, GovernanceLevel.STANDARD),
            new TagDefinition(DATA_QUALITY, TagCategory.QUALITY, "Data quality tier",
                    List.of("gold", "silver", "bronze", "raw"), false, "bronze", GovernanceLevel.STANDARD),
            new TagDefinition(ENVIRONMENT, TagCategory.LIFECYCLE, "Environment tier",
                    List.of("production", "staging", "development", "sandbox"), true, null, GovernanceLevel.RESTRICTED),
            new TagDefinition(COMPLIANCE_SCOPE, TagCategory.COMPLIANCE, "Compliance requirements",
                    List.of("gdpr", "hipaa", "sox", "pci", "none"), false, null, GovernanceLevel.AUDIT),
            new TagDefinition(COST_CENTER, TagCategory.OWNERSHIP, "Cost allocation center",
                    null, false, null, GovernanceLevel.STANDARD),
            new TagDefinition(OWNER_TEAM, TagCategory.OWNERSHIP, "Owning team",
                    null, true, null, GovernanceLevel.STANDARD),
            new TagDefinition(STORAGE_FORMAT, TagCategory.TECHNICAL, "Data storage format",
                    List.of("parquet", "delta", "iceberg", "json", "csv", "avro"), false, null, GovernanceLevel.STANDARD),
            new TagDefinition(RETENTION_DAYS, TagCategory.TECHNICAL, "Data retention period in days",
                    null, false, null, GovernanceLevel.RESTRICTED));

    private StandardTags() {
    }

    public static List<TagDefinition> definitions() {
        return DEFINITIONS;
    }
}

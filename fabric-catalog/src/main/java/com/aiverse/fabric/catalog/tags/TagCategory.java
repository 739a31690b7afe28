package com.aiverse.fabric.catalog.tags;

/** Classification of catalog tags. */
public enum TagCategory {
    /** Sensitivity, e.g. pii, phi, confidential. */
    CLASSIFICATION,
    /** Business domain, e.g. finance, hr, sales. */
    DOMAIN,
    QUALITY,
    LIFECYCLE,
    COMPLIANCE,
    OWNERSHIP,
    TECHNICAL
}

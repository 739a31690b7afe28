package com.aiverse.fabric.catalog.tags;

/** How tightly changes to a tag are governed. AUDIT changes are audited; RESTRICTED changes need elevated rights. */
public enum GovernanceLevel {
    STANDARD,
    RESTRICTED,
    AUDIT
}

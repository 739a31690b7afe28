package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Tenant identity carried by every unit invocation. Organization and workspace together form the
 * isolation boundary; the user is the actor.
 */
public record TenantContext(
        @JsonProperty("organization_id") UUID organizationId,
        @JsonProperty("workspace_id") UUID workspaceId,
        @JsonProperty("user_id") UUID userId) {

    public TenantContext {
        Objects.requireNonNull(organizationId, "organization_id");
        Objects.requireNonNull(workspaceId, "workspace_id");
        Objects.requireNonNull(userId, "user_id");
    }

    /** Registry and key scope for this tenant: {@code <organization_id>/<workspace_id>}. */
    public String tenantId() {
        return organizationId + "/" + workspaceId;
    }
}

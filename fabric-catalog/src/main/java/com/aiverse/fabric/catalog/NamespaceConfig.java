package com.aiverse.fabric.catalog;

import com.aiverse.fabric.contracts.TenantContext;

import java.util.List;
import java.util.Objects;

/**
 * Namespace hierarchy and isolation rules for the multi-tenant catalog. Namespaces are '/'-joined paths
 * following {@link #getHierarchy()}, e.g. {@code <org>/<workspace>/<project>/<dataset>}.
 */
public final class NamespaceConfig {

    public static final String DEFAULT_NAMING_PATTERN = "{org}/{workspace}/{project}/{dataset}";

    private final List<NamespaceLevel> hierarchy;
    private final IsolationMode isolationMode;
    private final boolean allowCrossWorkspace;
    private final boolean allowCrossOrganization;
    private final String namingPattern;

    private NamespaceConfig(Builder b) {
        this.hierarchy = List.copyOf(b.hierarchy);
        this.isolationMode = Objects.requireNonNull(b.isolationMode, "isolationMode");
        this.allowCrossWorkspace = b.allowCrossWorkspace;
        this.allowCrossOrganization = b.allowCrossOrganization;
        this.namingPattern = b.namingPattern;
    }

    /** Four-level hierarchy, strict isolation, no cross-workspace or cross-organization access. */
    public static NamespaceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<NamespaceLevel> getHierarchy() {
        return hierarchy;
    }

    public IsolationMode getIsolationMode() {
        return isolationMode;
    }

    public boolean isAllowCrossWorkspace() {
        return allowCrossWorkspace;
    }

    public boolean isAllowCrossOrganization() {
        return allowCrossOrganization;
    }

    public String getNamingPattern() {
        return namingPattern;
    }

    /** True if the namespace has between one and {@code hierarchy.size()} non-blank segments. */
    public boolean validateNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) return false;
        String[] parts = namespace.split("/", -1);
        if (parts.length > hierarchy.size()) return false;
        for (String part : parts) {
            if (part.isBlank()) return false;
        }
        return true;
    }

    /** Catalog scope visible to the tenant under the configured isolation mode. */
    public String getIsolationScope(TenantContext tenant) {
        if (isolationMode == IsolationMode.STRICT) {
            return tenant.organizationId() + "/" + tenant.workspaceId();
        }
        return tenant.organizationId().toString();
    }

    public static final class Builder {
        private List<NamespaceLevel> hierarchy = List.of(NamespaceLevel.values());
        private IsolationMode isolationMode = IsolationMode.STRICT;
        private boolean allowCrossWorkspace;
        private boolean allowCrossOrganization;
        private String namingPattern = DEFAULT_NAMING_PATTERN;

        public Builder hierarchy(List<NamespaceLevel> hierarchy) {
            if (hierarchy == null || hierarchy.isEmpty()) {
                throw new IllegalArgumentException("Namespace hierarchy must not be empty");
            }
            this.hierarchy = hierarchy;
            return this;
        }

        public Builder isolationMode(IsolationMode isolationMode) {
            this.isolationMode = isolationMode;
            return this;
        }

        public Builder allowCrossWorkspace(boolean allow) {
            this.allowCrossWorkspace = allow;
            return this;
        }

        public Builder allowCrossOrganization(boolean allow) {
            this.allowCrossOrganization = allow;
            return this;
        }

        public Builder namingPattern(String namingPattern) {
            this.namingPattern = namingPattern;
            return this;
        }

        public NamespaceConfig build() {
            return new NamespaceConfig(this);
        }
    }
}

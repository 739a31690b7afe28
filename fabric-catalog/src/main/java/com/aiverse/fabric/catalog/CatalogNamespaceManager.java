package com.aiverse.fabric.catalog;

import com.aiverse.fabric.contracts.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Namespaces of the data catalog and the entries registered in them, with tenant access checks
 * driven by {@link NamespaceConfig}.
 */
public final class CatalogNamespaceManager {

    private static final Logger log = LoggerFactory.getLogger(CatalogNamespaceManager.class);

    private final NamespaceConfig config;
    private final Clock clock;
    /** Namespace to entry ids, in registration order. Sorted by namespace. */
    private final Map<String, List<String>> namespaces = new ConcurrentSkipListMap<>();
    private final Map<String, CatalogEntry> entries = new ConcurrentHashMap<>();

    public CatalogNamespaceManager(NamespaceConfig config) {
        this(config, Clock.systemUTC());
    }

    public CatalogNamespaceManager(NamespaceConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public NamespaceConfig getConfig() {
        return config;
    }

    public String createNamespace(String orgId, String workspaceId) {
        return createNamespace(orgId, workspaceId, null);
    }

    /**
     * Creates {@code org/workspace} or {@code org/workspace/project}. Creating an existing namespace keeps its entries.
     *
     * @throws IllegalArgumentException if the resulting path does not fit the hierarchy
     */
    public String createNamespace(String orgId, String workspaceId, String projectId) {
        String ns = projectId != null && !projectId.isBlank()
                ? orgId + "/" + workspaceId + "/" + projectId
                : orgId + "/" + workspaceId;
        if (!config.validateNamespace(ns)) {
            throw new IllegalArgumentException("Invalid namespace: " + ns);
        }
        if (namespaces.putIfAbsent(ns, new CopyOnWriteArrayList<>()) == null) {
            log.info("Created catalog namespace {}", ns);
        }
        return ns;
    }

    public boolean namespaceExists(String namespace) {
        return namespace != null && namespaces.containsKey(namespace);
    }

    /**
     * Registers the entry under the namespace and returns it with the namespace set.
     *
     * @throws IllegalArgumentException if the namespace was never created
     */
    public CatalogEntry registerEntry(String namespace, CatalogEntry entry) {
        List<String> ids = namespace != null ? namespaces.get(namespace) : null;
        if (ids == null) {
            throw new IllegalArgumentException("Namespace not found: " + namespace);
        }
        CatalogEntry registered = entry.inNamespace(namespace, clock.instant());
        if (entries.put(registered.entryId(), registered) == null) {
            ids.add(registered.entryId());
        }
        log.debug("Registered catalog entry {} ({})", registered.fullyQualifiedName(), registered.entryType());
        return registered;
    }

    public Optional<CatalogEntry> getEntry(String entryId) {
        return entryId == null ? Optional.empty() : Optional.ofNullable(entries.get(entryId));
    }

    /** Entries of the namespace in registration order; empty for an unknown namespace. */
    public List<CatalogEntry> listEntries(String namespace) {
        List<String> ids = namespace != null ? namespaces.get(namespace) : null;
        if (ids == null) return List.of();
        List<CatalogEntry> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            CatalogEntry e = entries.get(id);
            if (e != null) out.add(e);
        }
        return out;
    }

    /**
     * The first path segment must be the tenant's organization and the second its workspace, unless the config
     * allows cross-organization or cross-workspace access.
     */
    public boolean canAccess(String namespace, TenantContext tenant) {
        if (namespace == null || tenant == null) return false;
        String[] parts = namespace.split("/");
        if (parts.length >= 1 && !parts[0].equals(tenant.organizationId().toString())
                && !config.isAllowCrossOrganization()) {
            return false;
        }
        if (parts.length >= 2 && !parts[1].equals(tenant.workspaceId().toString())
                && !config.isAllowCrossWorkspace()) {
            return false;
        }
        return true;
    }

    /** Accessible namespaces, sorted. */
    public List<String> listAccessibleNamespaces(TenantContext tenant) {
        List<String> out = new ArrayList<>();
        for (String ns : namespaces.keySet()) {
            if (canAccess(ns, tenant)) out.add(ns);
        }
        return out;
    }

    public void clear() {
        namespaces.clear();
        entries.clear();
    }
}

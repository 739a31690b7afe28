package com.aiverse.fabric.catalog;

import com.aiverse.fabric.contracts.Copies;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One entry of the data catalog (dataset, feature set, connection or schema).
 *
 * @param namespace set by {@link CatalogNamespaceManager#registerEntry}; empty until registered
 * @param entryType e.g. {@code dataset}, {@code feature_set}, {@code connection}, {@code schema}
 */
public record CatalogEntry(
        String entryId,
        String namespace,
        String entryType,
        String name,
        String version,
        String ownerOrg,
        String ownerWorkspace,
        String ownerUser,
        Map<String, String> tags,
        String schemaRef,
        List<String> lineageRefs,
        EntryStatus status,
        Instant createdAt,
        Instant updatedAt) {

    public static final String DEFAULT_VERSION = "1.0.0";

    public CatalogEntry {
        entryId = entryId != null ? entryId : UUID.randomUUID().toString();
        namespace = namespace != null ? namespace : "";
        Objects.requireNonNull(entryType, "entryType");
        Objects.requireNonNull(name, "name");
        version = version != null ? version : DEFAULT_VERSION;
        tags = Copies.map(tags);
        lineageRefs = Copies.list(lineageRefs);
        status = status != null ? status : EntryStatus.ACTIVE;
    }

    /** Active, unregistered entry with a generated id and the default version. */
    public static CatalogEntry of(String entryType, String name, Map<String, String> tags) {
        return new CatalogEntry(null, null, entryType, name, null, null, null, null, tags, null, null, null, null, null);
    }

    /** {@code <namespace>/<name>@<version>}. */
    public String fullyQualifiedName() {
        return namespace + "/" + name + "@" + version;
    }

    CatalogEntry inNamespace(String ns, Instant at) {
        return new CatalogEntry(entryId, ns, entryType, name, version, ownerOrg, ownerWorkspace, ownerUser, tags,
                schemaRef, lineageRefs, status, createdAt != null ? createdAt : at, at);
    }
}

package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.Map;

/** Immutable dataset commits. */
public interface CommitStore {

    /**
     * @param parentRef null for a root commit
     * @return commit id
     * @throws PortException {@code WRITE_FAILURE}
     */
    String createCommit(String datasetRef, String parentRef, String contentHash, Map<String, Integer> changeset,
                        String message, String author, TenantContext tenant) throws PortException;

    /** Commit record, or null when unknown. */
    Map<String, Object> getCommit(String commitRef, TenantContext tenant) throws PortException;

    /**
     * @throws PortException {@code READ_FAILURE}
     */
    byte[] getCommitContent(String commitRef, TenantContext tenant) throws PortException;
}

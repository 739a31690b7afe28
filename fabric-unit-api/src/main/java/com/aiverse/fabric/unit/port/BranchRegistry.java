package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

public interface BranchRegistry {

    /**
     * @return branch id assigned by the registry
     * @throws PortException {@code WRITE_FAILURE}
     */
    String createBranch(String datasetRef, String branchName, String headCommitRef, TenantContext tenant)
            throws PortException;

    boolean branchExists(String datasetRef, String branchName, TenantContext tenant) throws PortException;
}

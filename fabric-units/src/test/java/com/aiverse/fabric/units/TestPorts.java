package com.aiverse.fabric.units;

import com.aiverse.fabric.contracts.ConsistencyMode;
import com.aiverse.fabric.contracts.DataFormat;
import com.aiverse.fabric.contracts.StoreType;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.port.BranchRegistry;
import com.aiverse.fabric.unit.port.CommitStore;
import com.aiverse.fabric.unit.port.DatasetReader;
import com.aiverse.fabric.unit.port.FeatureStoreClient;
import com.aiverse.fabric.unit.port.LabelTaskRegistry;
import com.aiverse.fabric.unit.port.StagingArea;
import com.aiverse.fabric.unit.port.StorageClient;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/** In-memory port fakes shared by the unit tests. */
public final class TestPorts {

    public static final TenantContext TENANT =
            new TenantContext(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

    private TestPorts() {
    }

    public static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    public static class Staging implements StagingArea {
        public final Map<String, byte[]> data = new HashMap<>();
        public PortFailure readFailure;
        public PortFailure writeFailure;

        public Staging put(String ref, String content) {
            data.put(ref, bytes(content));
            return this;
        }

        @Override
        public StagedData read(String stagingRef, TenantContext tenant) throws PortException {
            if (readFailure != null) throw new PortException(readFailure, "staging read " + stagingRef);
            byte[] b = data.get(stagingRef);
            if (b == null) throw new PortException(PortFailure.READ_FAILURE, "no such staging ref " + stagingRef);
            return new StagedData(b, Map.of());
        }

        @Override
        public long write(String stagingRef, byte[] content, DataFormat format, TenantContext tenant)
                throws PortException {
            if (writeFailure != null) throw new PortException(writeFailure, "staging write " + stagingRef);
            data.put(stagingRef, content);
            return content.length;
        }
    }

    public static class Datasets implements DatasetReader {
        public final Map<String, byte[]> content = new HashMap<>();
        public final Map<String, Integer> changeset = new LinkedHashMap<>();
        public PortFailure failure;

        @Override
        public byte[] readDataset(String datasetRef, TenantContext tenant) throws PortException {
            if (failure != null) throw new PortException(failure, "dataset " + datasetRef);
            return content.getOrDefault(datasetRef, new byte[0]);
        }

        @Override
        public DatasetState readDatasetState(String datasetRef, TenantContext tenant) throws PortException {
            return new DatasetState(readDataset(datasetRef, tenant), changeset);
        }
    }

    public static class Commits implements CommitStore {
        public final Map<String, Map<String, Object>> commits = new HashMap<>();
        public final Map<String, byte[]> contents = new HashMap<>();
        public PortFailure createFailure;
        public PortFailure contentFailure;
        public String lastAuthor;
        public String lastHash;

        public Commits add(String ref, String content) {
            commits.put(ref, Map.of("commit_id", ref));
            contents.put(ref, bytes(content));
            return this;
        }

        @Override
        public String createCommit(String datasetRef, String parentRef, String contentHash,
                                   Map<String, Integer> changeset, String message, String author,
                                   TenantContext tenant) throws PortException {
            if (createFailure != null) throw new PortException(createFailure, "commit store down");
            lastAuthor = author;
            lastHash = contentHash;
            String id = "c-" + contentHash.substring(0, 8);
            commits.put(id, Map.of("commit_id", id, "dataset_ref", datasetRef));
            return id;
        }

        @Override
        public Map<String, Object> getCommit(String commitRef, TenantContext tenant) {
            return commits.get(commitRef);
        }

        @Override
        public byte[] getCommitContent(String commitRef, TenantContext tenant) throws PortException {
            if (contentFailure != null) throw new PortException(contentFailure, "content " + commitRef);
            return contents.get(commitRef);
        }
    }

    public static class Branches implements BranchRegistry {
        public final Set<String> branches = new HashSet<>();
        public PortFailure failure;

        @Override
        public String createBranch(String datasetRef, String branchName, String headCommitRef, TenantContext tenant)
                throws PortException {
            if (failure != null) throw new PortException(failure, "registry down");
            branches.add(datasetRef + "/" + branchName);
            return branchName;
        }

        @Override
        public boolean branchExists(String datasetRef, String branchName, TenantContext tenant) {
            return branches.contains(datasetRef + "/" + branchName);
        }
    }

    public static class Storage implements StorageClient {
        public final Map<String, byte[]> locations = new HashMap<>();
        public PortFailure readFailure;
        public PortFailure writeFailure;
        public boolean corruptWrites;
        public boolean failVerification;
        private int reads;

        @Override
        public byte[] readLocation(String locationRef, TenantContext tenant) throws PortException {
            reads++;
            if (readFailure != null) throw new PortException(readFailure, "read " + locationRef);
            if (failVerification && reads > 1) throw new PortException(PortFailure.NETWORK, "verify " + locationRef);
            byte[] b = locations.get(locationRef);
            if (b == null) throw new PortException(PortFailure.READ_FAILURE, "missing " + locationRef);
            return b;
        }

        @Override
        public String writeLocation(String locationRef, byte[] data, ConsistencyMode consistencyMode,
                                    TenantContext tenant) throws PortException {
            if (writeFailure != null) throw new PortException(writeFailure, "write " + locationRef);
            locations.put(locationRef, corruptWrites ? bytes("corrupted") : data);
            return locationRef + "@confirmed";
        }
    }

    public static class FeatureStore implements FeatureStoreClient {
        public final List<FeatureRecord> records = new ArrayList<>();
        public PortFailure failure;
        public long lastTtl;

        @Override
        public FeatureStoreWrite writeFeatures(byte[] featureData, String featureSetRef, StoreType storeType,
                                               long ttlSeconds, TenantContext tenant) throws PortException {
            if (failure != null) throw new PortException(failure, "feature store");
            lastTtl = ttlSeconds;
            return new FeatureStoreWrite(featureData.length, storeType.value() + "://" + featureSetRef);
        }

        @Override
        public List<FeatureRecord> readFeatures(String featureSetRef, List<Map<String, Object>> entityKeys,
                                                List<String> featureNames, Instant pointInTime,
                                                StoreType storeType, TenantContext tenant) throws PortException {
            if (failure != null) throw new PortException(failure, "feature store");
            return records;
        }
    }

    public static class Tasks implements LabelTaskRegistry {
        public final Map<String, Map<String, Object>> tasks = new HashMap<>();
        public PortFailure failure;
        public List<String> lastSamples;

        @Override
        public String createTask(String datasetRef, String schemaRef, List<String> sampleIds,
                                 Map<String, Double> qualityRequirements, TenantContext tenant)
                throws PortException {
            if (failure != null) throw new PortException(failure, "task registry");
            lastSamples = sampleIds;
            String id = "task-" + (tasks.size() + 1);
            tasks.put(id, Map.of("sample_ids", sampleIds, "schema_ref", schemaRef));
            return id;
        }

        @Override
        public Map<String, Object> getTask(String taskRef, TenantContext tenant) {
            return tasks.get(taskRef);
        }
    }
}

package com.aiverse.fabric.worker;

import com.aiverse.fabric.contracts.AssetType;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortBindings;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.PortProvider;
import com.aiverse.fabric.unit.port.DatasetReader;
import com.aiverse.fabric.unit.port.ProfileEngine;
import com.aiverse.fabric.unit.port.RegistryClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Port fakes for the profiling and registration units. Bound through {@link #provider()} the way an adapter
 * would bind real ports.
 */
public final class WorkerTestPorts {

    public final Datasets datasets = new Datasets();
    public final Profiles profiles = new Profiles();
    public final Registry registry = new Registry();

    public static TenantContext newTenant() {
        return new TenantContext(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
    }

    public PortProvider provider() {
        return new PortProvider() {
            @Override
            public String name() {
                return "worker-test-ports";
            }

            @Override
            public void bind(PortBindings bindings) {
                bindings.bind(DatasetReader.class, datasets);
                bindings.bind(ProfileEngine.class, profiles);
                bindings.bind(RegistryClient.class, registry);
            }
        };
    }

    public static final class Datasets implements DatasetReader {
        public PortFailure failure;

        @Override
        public byte[] readDataset(String datasetRef, TenantContext tenant) throws PortException {
            if (failure != null) throw new PortException(failure, "dataset " + datasetRef);
            return ("id,amount\n1,10\n2,\n").getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public DatasetState readDatasetState(String datasetRef, TenantContext tenant) throws PortException {
            return new DatasetState(readDataset(datasetRef, tenant), Map.of());
        }
    }

    public static final class Profiles implements ProfileEngine {
        public PortFailure failure;
        public RuntimeException crash;
        public final List<String> depths = new ArrayList<>();

        @Override
        public ProfileOutput computeProfile(byte[] dataset, int sampleSize, String profilingDepth) throws PortException {
            if (crash != null) throw crash;
            if (failure != null) throw new PortException(failure, "profile");
            depths.add(profilingDepth);
            return new ProfileOutput(
                    List.of(Map.of("column_name", "amount", "null_count", 1, "distinct_count", 1)),
                    Map.of("completeness", 0.5), List.of(), false);
        }
    }

    public static final class Registry implements RegistryClient {
        public final List<String> created = new ArrayList<>();
        public PortFailure failure;

        @Override
        public String createCard(TenantContext tenant, AssetType assetType, String name, String version,
                                 Map<String, Object> metadata) throws PortException {
            if (failure != null) throw new PortException(failure, "registry");
            created.add(name + ":" + version);
            return "card-" + created.size();
        }
    }
}

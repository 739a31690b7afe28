package com.aiverse.fabric.mcop;

import com.aiverse.fabric.contracts.replication.LocalitySignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Declares the scheduling profile of each data-fabric execution unit to MCOP. Purely declarative.
 */
public final class CapabilityProvider {

    private static final Logger log = LoggerFactory.getLogger(CapabilityProvider.class);

    public static final String DOMAIN = DataFabricIntents.DOMAIN;

    private static final Map<String, CapabilityProfile> PROFILES = profiles();

    private final CapabilityScheduler scheduler;
    private final Set<String> provided = ConcurrentHashMap.newKeySet();

    public CapabilityProvider() {
        this(null);
    }

    public CapabilityProvider(CapabilityScheduler scheduler) {
        this.scheduler = scheduler;
    }

    private static Map<String, CapabilityProfile> profiles() {
        Map<String, CapabilityProfile> m = new LinkedHashMap<>();
        m.put("DataAssetRegistrar", p("data-registration", "cpu-small", "low", "write-registry", "registry", "metadata"));
        m.put("ConnectionProbe", p("connection-testing", "cpu-small", "low", "network-probe", "connection", "health"));
        m.put("SchemaIntrospector", p("schema-discovery", "cpu-small", "low", "read-external", "schema", "discovery"));
        m.put("DataExtractor", p("data-extraction", "cpu-medium", "medium", "read-external-write-staging", "extraction", "ingestion"));
        m.put("DataWriter", p("data-writing", "cpu-medium", "medium", "read-staging-write-dataset", "write", "persistence"));
        m.put("TransformExecutor", p("data-transformation", "cpu-large", "high", "read-process-write", "transform", "processing"));
        m.put("DataJoiner", p("data-joining", "cpu-large", "high", "read-multi-write", "join", "merge"));
        m.put("AggregationComputer", p("data-aggregation", "cpu-medium", "high", "read-aggregate-write", "aggregation", "analytics"));
        m.put("FeatureComputer", p("feature-computation", "cpu-large", "high", "read-compute-write", "feature", "ml"));
        m.put("FeatureStoreWriter", p("feature-storage", "cpu-medium", "medium", "read-staging-write-store", "feature", "store"));
        m.put("FeatureRetriever", p("feature-retrieval", "cpu-small", "low", "read-store", "feature", "retrieval"));
        m.put("DataProfiler", p("data-profiling", "cpu-medium", "medium", "read-analyze", "profiling", "quality"));
        m.put("SchemaValidator", p("schema-validation", "cpu-small", "low", "read-validate", "schema", "validation"));
        m.put("DataCommitter", p("data-versioning", "cpu-small", "low", "read-commit", "commit", "versioning"));
        m.put("BranchCreator", p("data-branching", "cpu-small", "low", "write-registry", "branch", "versioning"));
        m.put("MergeComputer", p("data-merging", "cpu-medium", "medium", "read-multi-compute", "merge", "versioning"));
        m.put("DataReplicator", p("data-replication", "cpu-medium", "medium", "read-write-remote", "replication", "locality"));
        m.put("LocalitySignalGenerator", p("locality-signaling", "cpu-small", "low", "read-probe", "locality", "scheduling"));
        m.put("LabelTaskCreator", p("labeling-task", "cpu-small", "low", "write-registry", "labeling", "task"));
        m.put("LabelRecorder", p("label-recording", "cpu-small", "low", "write-store", "labeling", "annotation"));
        m.put("LineageEdgeWriter", p("lineage-recording", "cpu-small", "low", "write-registry", "lineage", "provenance"));
        m.put("QualityGateEvaluator", p("quality-evaluation", "cpu-medium", "medium", "read-evaluate", "quality", "gate"));
        return Collections.unmodifiableMap(m);
    }

    private static CapabilityProfile p(String type, String compute, String memory, String io, String tag1, String tag2) {
        return new CapabilityProfile(type, compute, memory, io, List.of(tag1, tag2, "stateless"));
    }

    /**
     * Sends every profile to the scheduler. Without a scheduler every unit reports true. A scheduler failure
     * is logged and reported as false for that unit.
     *
     * @return unit name to outcome, in declaration order
     */
    public Map<String, Boolean> provideAllCapabilities() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        if (scheduler == null) {
            PROFILES.keySet().forEach(name -> results.put(name, true));
            return results;
        }
        for (Map.Entry<String, CapabilityProfile> e : PROFILES.entrySet()) {
            boolean ok;
            try {
                ok = scheduler.provideCapability(e.getKey(), e.getValue());
            } catch (McopException | RuntimeException ex) {
                log.warn("Failed to provide capability {}: {}", e.getKey(), ex.getMessage());
                ok = false;
            }
            results.put(e.getKey(), ok);
            if (ok) provided.add(e.getKey());
        }
        log.info("Provided {}/{} capabilities to MCOP", provided.size(), PROFILES.size());
        return results;
    }

    /** True without a scheduler; false if the scheduler fails. */
    public boolean provideLocalitySignals(UUID intentRef, String assetRef, List<LocalitySignal> signals) {
        if (scheduler == null) return true;
        try {
            return scheduler.provideLocalitySignals(intentRef, assetRef, signals);
        } catch (McopException | RuntimeException e) {
            log.warn("Failed to provide locality signals for {}: {}", assetRef, e.getMessage());
            return false;
        }
    }

    /** Profile of the unit, or null. */
    public CapabilityProfile getCapabilityProfile(String executionUnitName) {
        return executionUnitName != null ? PROFILES.get(executionUnitName) : null;
    }

    public Map<String, CapabilityProfile> getAllProfiles() {
        return PROFILES;
    }

    /** Units the scheduler accepted, sorted. */
    public Set<String> getProvidedCapabilities() {
        return Collections.unmodifiableSet(new TreeSet<>(provided));
    }

    public int getCapabilityCount() {
        return PROFILES.size();
    }
}

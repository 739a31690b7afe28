package com.aiverse.fabric.mcop;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decomposition of each data-fabric intent into execution units. Units of an intent are scheduled independently
 * by MCOP; this table only names them and maps intent inputs onto their parameters.
 */
public final class DataFabricIntents {

    public static final String DOMAIN = "data-fabric";

    private static final UnitReference DATA_WRITER = new UnitReference("DataWriter", "data-writing", Map.of(
            "staging_ref", "write_input.staging_ref",
            "target_dataset_ref", "write_input.target_dataset_ref"));
    private static final UnitReference LINEAGE_EDGE_WRITER = new UnitReference("LineageEdgeWriter", "lineage-recording", Map.of(
            "source_asset_ref", "edge_input.source_asset_ref",
            "target_asset_ref", "edge_input.target_asset_ref"));
    private static final UnitReference DATA_COMMITTER = new UnitReference("DataCommitter", "data-versioning", Map.of(
            "dataset_ref", "commit_input.dataset_ref",
            "commit_message", "commit_input.commit_message"));

    private static final Map<String, List<UnitReference>> INTENTS = build();

    private DataFabricIntents() {
    }

    private static Map<String, List<UnitReference>> build() {
        Map<String, List<UnitReference>> m = new LinkedHashMap<>();
        m.put("RegisterDataAsset", List.of(
                new UnitReference("DataAssetRegistrar", "data-registration", Map.of(
                        "asset_declaration", "asset_declaration",
                        "owner_ref", "owner_ref"))));
        m.put("IngestData", List.of(
                new UnitReference("DataExtractor", "data-extraction", Map.of(
                        "source_connection_ref", "extraction_input.source_connection_ref",
                        "source_query_or_path", "extraction_input.source_query_or_path")),
                DATA_WRITER,
                LINEAGE_EDGE_WRITER));
        m.put("TransformData", List.of(
                new UnitReference("TransformExecutor", "data-transformation", Map.of(
                        "input_data_ref", "transform_input.input_data_ref",
                        "transformation_definition", "transform_input.transformation_definition")),
                DATA_WRITER,
                LINEAGE_EDGE_WRITER));
        m.put("MaterializeFeatures", List.of(
                new UnitReference("FeatureComputer", "feature-computation", Map.of(
                        "source_data_ref", "compute_input.source_data_ref",
                        "feature_definition_ref", "compute_input.feature_definition_ref")),
                new UnitReference("FeatureStoreWriter", "feature-storage", Map.of(
                        "staging_ref", "write_input.staging_ref",
                        "feature_set_ref", "write_input.feature_set_ref"))));
        m.put("RetrieveFeatures", List.of(
                new UnitReference("FeatureRetriever", "feature-retrieval", Map.of(
                        "feature_set_ref", "retrieve_input.feature_set_ref",
                        "entity_keys", "retrieve_input.entity_keys"))));
        m.put("ProfileData", List.of(
                new UnitReference("DataProfiler", "data-profiling", Map.of(
                        "dataset_ref", "profile_input.dataset_ref",
                        "sample_size", "profile_input.sample_size"))));
        m.put("CommitDataVersion", List.of(DATA_COMMITTER));
        m.put("BranchDataset", List.of(
                new UnitReference("BranchCreator", "data-branching", Map.of(
                        "dataset_ref", "branch_input.dataset_ref",
                        "source_commit_ref", "branch_input.source_commit_ref"))));
        m.put("MergeDataBranches", List.of(
                new UnitReference("MergeComputer", "data-merging", Map.of(
                        "source_commit_ref", "merge_input.source_commit_ref",
                        "target_commit_ref", "merge_input.target_commit_ref")),
                DATA_COMMITTER));
        m.put("CreateLabelTask", List.of(
                new UnitReference("LabelTaskCreator", "labeling-task", Map.of(
                        "source_dataset_ref", "task_input.source_dataset_ref",
                        "label_schema_ref", "task_input.label_schema_ref"))));
        m.put("TestConnection", List.of(
                new UnitReference("ConnectionProbe", "connection-testing", Map.of(
                        "connection_ref", "probe_input.connection_ref",
                        "timeout_seconds", "probe_input.timeout_seconds",
                        "connection_config", "connection_config"))));
        m.put("DiscoverSchema", List.of(
                new UnitReference("SchemaIntrospector", "schema-discovery", Map.of(
                        "connection_ref", "introspection_input.connection_ref",
                        "source_path", "introspection_input.source_path"))));
        m.put("ReplicateData", List.of(
                new UnitReference("DataReplicator", "data-replication", Map.of(
                        "source_location_ref", "replication_input.source_location_ref",
                        "target_location_ref", "replication_input.target_location_ref"))));
        m.put("QueryLocality", List.of(
                new UnitReference("LocalitySignalGenerator", "locality-signaling", Map.of(
                        "asset_ref", "asset_ref"))));
        m.put("ValidateSchema", List.of(
                new UnitReference("SchemaValidator", "schema-validation", Map.of(
                        "dataset_ref", "validation_input.dataset_ref",
                        "expected_schema_ref", "validation_input.expected_schema_ref"))));
        return Collections.unmodifiableMap(m);
    }

    /** Intent type to its units, in declaration order. */
    public static Map<String, List<UnitReference>> all() {
        return INTENTS;
    }

    public static List<UnitReference> unitsFor(String intentType) {
        return intentType != null ? INTENTS.get(intentType) : null;
    }
}

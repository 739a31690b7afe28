package com.aiverse.fabric.units;

import com.aiverse.fabric.unit.PortBindings;
import com.aiverse.fabric.unit.UnitProvider;
import com.aiverse.fabric.unit.UnitRegistry;
import com.aiverse.fabric.unit.port.AggregationEngine;
import com.aiverse.fabric.unit.port.AnnotationStore;
import com.aiverse.fabric.unit.port.AssetRegistry;
import com.aiverse.fabric.unit.port.BranchRegistry;
import com.aiverse.fabric.unit.port.CommitStore;
import com.aiverse.fabric.unit.port.ConnectionDriver;
import com.aiverse.fabric.unit.port.CredentialResolver;
import com.aiverse.fabric.unit.port.DataReader;
import com.aiverse.fabric.unit.port.DatasetReader;
import com.aiverse.fabric.unit.port.DatasetRegistry;
import com.aiverse.fabric.unit.port.DatasetWriter;
import com.aiverse.fabric.unit.port.EnvironmentDiscovery;
import com.aiverse.fabric.unit.port.FeatureDefinitionResolver;
import com.aiverse.fabric.unit.port.FeatureEngine;
import com.aiverse.fabric.unit.port.FeatureStoreClient;
import com.aiverse.fabric.unit.port.JoinEngine;
import com.aiverse.fabric.unit.port.LabelSchemaValidator;
import com.aiverse.fabric.unit.port.LabelTaskRegistry;
import com.aiverse.fabric.unit.port.LabelValidator;
import com.aiverse.fabric.unit.port.LineageStore;
import com.aiverse.fabric.unit.port.LocalityProber;
import com.aiverse.fabric.unit.port.MergeEngine;
import com.aiverse.fabric.unit.port.ProfileEngine;
import com.aiverse.fabric.unit.port.QualityEngine;
import com.aiverse.fabric.unit.port.QualityRulesResolver;
import com.aiverse.fabric.unit.port.RegistryClient;
import com.aiverse.fabric.unit.port.SampleSelector;
import com.aiverse.fabric.unit.port.SchemaReader;
import com.aiverse.fabric.unit.port.SchemaResolver;
import com.aiverse.fabric.unit.port.StagingArea;
import com.aiverse.fabric.unit.port.StorageClient;
import com.aiverse.fabric.unit.port.TransformEngine;
import com.aiverse.fabric.unit.port.ValidationEngine;
import com.aiverse.fabric.units.connection.ConnectionProbe;
import com.aiverse.fabric.units.feature.FeatureComputer;
import com.aiverse.fabric.units.feature.FeatureRetriever;
import com.aiverse.fabric.units.feature.FeatureStoreWriter;
import com.aiverse.fabric.units.ingestion.DataExtractor;
import com.aiverse.fabric.units.ingestion.DataWriter;
import com.aiverse.fabric.units.labeling.LabelRecorder;
import com.aiverse.fabric.units.labeling.LabelTaskCreator;
import com.aiverse.fabric.units.lineage.LineageEdgeWriter;
import com.aiverse.fabric.units.quality.DataProfiler;
import com.aiverse.fabric.units.quality.QualityGateEvaluator;
import com.aiverse.fabric.units.quality.SchemaValidator;
import com.aiverse.fabric.units.registration.DataAssetRegistrar;
import com.aiverse.fabric.units.replication.DataReplicator;
import com.aiverse.fabric.units.replication.LocalitySignalGenerator;
import com.aiverse.fabric.units.schema.SchemaIntrospector;
import com.aiverse.fabric.units.transform.AggregationComputer;
import com.aiverse.fabric.units.transform.DataJoiner;
import com.aiverse.fabric.units.transform.TransformExecutor;
import com.aiverse.fabric.units.versioning.BranchCreator;
import com.aiverse.fabric.units.versioning.DataCommitter;
import com.aiverse.fabric.units.versioning.MergeComputer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The built-in execution units. The worker calls {@link #registerAll(UnitRegistry, String, PortBindings)}
 * once per tenant after adapters have bound their ports; a unit whose ports are not all bound is skipped.
 */
public final class InternalUnits {

    private static final Logger log = LoggerFactory.getLogger(InternalUnits.class);

    private static final List<UnitProvider> PROVIDERS = List.of(
            new AnnotatedUnitProvider(DataAssetRegistrar.class, List.of(RegistryClient.class),
                    p -> new DataAssetRegistrar(p.require(RegistryClient.class))),
            new AnnotatedUnitProvider(ConnectionProbe.class,
                    List.of(CredentialResolver.class, ConnectionDriver.class),
                    p -> new ConnectionProbe(p.require(CredentialResolver.class), p.require(ConnectionDriver.class))),
            new AnnotatedUnitProvider(SchemaIntrospector.class, List.of(SchemaReader.class),
                    p -> new SchemaIntrospector(p.require(SchemaReader.class))),
            new AnnotatedUnitProvider(DataExtractor.class, List.of(DataReader.class, StagingArea.class),
                    p -> new DataExtractor(p.require(DataReader.class), p.require(StagingArea.class))),
            new AnnotatedUnitProvider(DataWriter.class, List.of(StagingArea.class, DatasetWriter.class),
                    p -> new DataWriter(p.require(StagingArea.class), p.require(DatasetWriter.class))),
            new AnnotatedUnitProvider(TransformExecutor.class, List.of(StagingArea.class, TransformEngine.class),
                    p -> new TransformExecutor(p.require(StagingArea.class), p.require(TransformEngine.class))),
            new AnnotatedUnitProvider(DataJoiner.class, List.of(StagingArea.class, JoinEngine.class),
                    p -> new DataJoiner(p.require(StagingArea.class), p.require(JoinEngine.class))),
            new AnnotatedUnitProvider(AggregationComputer.class,
                    List.of(StagingArea.class, AggregationEngine.class),
                    p -> new AggregationComputer(p.require(StagingArea.class), p.require(AggregationEngine.class))),
            new AnnotatedUnitProvider(FeatureComputer.class,
                    List.of(FeatureDefinitionResolver.class, StagingArea.class, FeatureEngine.class),
                    p -> new FeatureComputer(p.require(FeatureDefinitionResolver.class),
                            p.require(StagingArea.class), p.require(FeatureEngine.class))),
            new AnnotatedUnitProvider(FeatureStoreWriter.class,
                    List.of(StagingArea.class, FeatureStoreClient.class),
                    p -> new FeatureStoreWriter(p.require(StagingArea.class), p.require(FeatureStoreClient.class))),
            new AnnotatedUnitProvider(FeatureRetriever.class, List.of(FeatureStoreClient.class),
                    p -> new FeatureRetriever(p.require(FeatureStoreClient.class))),
            new AnnotatedUnitProvider(DataProfiler.class, List.of(DatasetReader.class, ProfileEngine.class),
                    p -> new DataProfiler(p.require(DatasetReader.class), p.require(ProfileEngine.class))),
            new AnnotatedUnitProvider(SchemaValidator.class,
                    List.of(SchemaResolver.class, DatasetReader.class, ValidationEngine.class),
                    p -> new SchemaValidator(p.require(SchemaResolver.class), p.require(DatasetReader.class),
                            p.require(ValidationEngine.class))),
            new AnnotatedUnitProvider(DataCommitter.class, List.of(DatasetReader.class, CommitStore.class),
                    p -> new DataCommitter(p.require(DatasetReader.class), p.require(CommitStore.class))),
            new AnnotatedUnitProvider(BranchCreator.class, List.of(CommitStore.class, BranchRegistry.class),
                    p -> new BranchCreator(p.require(CommitStore.class), p.require(BranchRegistry.class))),
            new AnnotatedUnitProvider(MergeComputer.class, List.of(CommitStore.class, MergeEngine.class),
                    p -> new MergeComputer(p.require(CommitStore.class), p.require(MergeEngine.class))),
            new AnnotatedUnitProvider(DataReplicator.class, List.of(StorageClient.class),
                    p -> new DataReplicator(p.require(StorageClient.class))),
            new AnnotatedUnitProvider(LocalitySignalGenerator.class,
                    List.of(AssetRegistry.class, LocalityProber.class, EnvironmentDiscovery.class),
                    p -> new LocalitySignalGenerator(p.require(AssetRegistry.class), p.require(LocalityProber.class),
                            p.require(EnvironmentDiscovery.class))),
            new AnnotatedUnitProvider(LabelTaskCreator.class,
                    List.of(DatasetRegistry.class, LabelSchemaValidator.class, SampleSelector.class,
                            LabelTaskRegistry.class),
                    p -> new LabelTaskCreator(p.require(DatasetRegistry.class), p.require(LabelSchemaValidator.class),
                            p.require(SampleSelector.class), p.require(LabelTaskRegistry.class))),
            new AnnotatedUnitProvider(LabelRecorder.class,
                    List.of(LabelTaskRegistry.class, LabelValidator.class, AnnotationStore.class),
                    p -> new LabelRecorder(p.require(LabelTaskRegistry.class), p.require(LabelValidator.class),
                            p.require(AnnotationStore.class))),
            new AnnotatedUnitProvider(LineageEdgeWriter.class, List.of(AssetRegistry.class, LineageStore.class),
                    p -> new LineageEdgeWriter(p.require(AssetRegistry.class), p.require(LineageStore.class))),
            new AnnotatedUnitProvider(QualityGateEvaluator.class,
                    List.of(QualityRulesResolver.class, DatasetReader.class, QualityEngine.class),
                    p -> new QualityGateEvaluator(p.require(QualityRulesResolver.class),
                            p.require(DatasetReader.class), p.require(QualityEngine.class))));

    private InternalUnits() {
    }

    public static List<UnitProvider> providers() {
        return PROVIDERS;
    }

    /**
     * Registers every built-in unit whose required ports are bound.
     *
     * @return number of units registered
     */
    public static int registerAll(UnitRegistry registry, String tenantId, PortBindings ports) {
        int registered = 0;
        for (UnitProvider provider : PROVIDERS) {
            if (!provider.isEnabled(ports)) {
                log.debug("Skipping unit {} for tenant {}: ports not bound", provider.getUnitId(), tenantId);
                continue;
            }
            registry.register(tenantId, provider.createUnit(ports), provider.getVersion(),
                    provider.getCapabilityMetadata());
            log.info("Registered unit {} ({}) for tenant {}", provider.getUnitId(),
                    provider.getCapabilityType(), tenantId);
            registered++;
        }
        return registered;
    }
}

package com.aiverse.fabric.worker.bootstrap;

import com.aiverse.fabric.config.FabricConfig;
import com.aiverse.fabric.config.TenantConfigRegistry;
import com.aiverse.fabric.config.TenantEntry;
import com.aiverse.fabric.features.FeatureRegistry;
import com.aiverse.fabric.features.UnitFeatureRunner;
import com.aiverse.fabric.features.metrics.MetricsFeature;
import com.aiverse.fabric.ledger.ExecutionLedger;
import com.aiverse.fabric.ledger.InMemoryExecutionStore;
import com.aiverse.fabric.ledger.LedgerFeature;
import com.aiverse.fabric.mcop.CapabilityProvider;
import com.aiverse.fabric.mcop.InMemoryAssetRegistryClient;
import com.aiverse.fabric.mcop.IntentEngine;
import com.aiverse.fabric.mcop.IntentHandler;
import com.aiverse.fabric.mcop.RegistryCardLoader;
import com.aiverse.fabric.ratelimit.RateLimiter;
import com.aiverse.fabric.signals.CompositeSpine;
import com.aiverse.fabric.signals.FeedbackSignalEmitter;
import com.aiverse.fabric.signals.FeedbackSignalRegistry;
import com.aiverse.fabric.signals.MeterRegistrySpine;
import com.aiverse.fabric.signals.SignalBus;
import com.aiverse.fabric.unit.AdapterManager;
import com.aiverse.fabric.unit.PortBindings;
import com.aiverse.fabric.unit.PortProvider;
import com.aiverse.fabric.unit.UnitRegistry;
import com.aiverse.fabric.units.InternalUnits;
import com.aiverse.fabric.worker.api.DataFabricGateway;
import com.aiverse.fabric.worker.engine.InProcessIntentEngine;
import com.aiverse.fabric.worker.engine.UnitInvoker;
import com.aiverse.fabric.worker.features.SignalEmissionFeature;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Wires the worker in dependency order: port adapters, execution units per tenant, observability, ledger,
 * features, MCOP integration and the API gateway.
 * <p>
 * Internal failures (a port provider, a duplicate feature, an unreadable tenant config file) abort startup. Adapter JARs, a capability scheduler
 * and a card the registry refuses are logged and skipped. A JDBC ledger that cannot be reached falls back to
 * the in-memory store.
 */
public final class FabricBootstrap {

    private static final Logger log = LoggerFactory.getLogger(FabricBootstrap.class);

    private FabricBootstrap() {
    }

    /** Initializes from {@code FABRIC_*} environment variables; the in-process engine runs on the caller's thread. */
    public static BootstrapContext initialize() {
        return initialize(FabricConfig.fromEnvironment(), List.of(), Runnable::run);
    }

    /**
     * @param portProviders providers registered ahead of those found on the classpath and in the adapters directory
     * @param executor      runs in-process intent executions; null means on the submitting thread
     */
    public static BootstrapContext initialize(FabricConfig config, List<PortProvider> portProviders, Executor executor) {
        AdapterManager adapters = new AdapterManager();
        if (portProviders != null) {
            portProviders.forEach(adapters::registerInternal);
        }
        adapters.discoverClasspath(FabricBootstrap.class.getClassLoader());
        String adaptersDir = config.getAdaptersDir();
        if (adaptersDir != null && !adaptersDir.isBlank()) {
            adapters.loadAdapters(Path.of(adaptersDir));
        }
        PortBindings ports = new PortBindings();
        int bound = adapters.bindAll(ports);
        log.info("Port providers bound: {} ({} internal, {} adapter); {} port(s) available",
                bound, adapters.getInternalCount(), adapters.getAdapterCount(), ports.boundTypes().size());

        List<String> tenantIds = new ArrayList<>(config.getTenantIds().isEmpty()
                ? List.of(FabricConfig.normalizeTenantId(null)) : config.getTenantIds());
        TenantConfigRegistry tenantConfigs = TenantConfigRegistry.getInstance();
        List<String> configuredTenants = loadTenantConfig(config.getTenantConfigFile(), tenantConfigs);
        for (String tenantId : configuredTenants) {
            if (!tenantIds.contains(tenantId)) tenantIds.add(tenantId);
        }
        UnitRegistry unitRegistry = UnitRegistry.getInstance();
        int units = 0;
        for (String tenantId : tenantIds) {
            units += InternalUnits.registerAll(unitRegistry, tenantId, ports);
        }
        if (units == 0) {
            log.warn("No execution units registered; bind ports with a PortProvider or FABRIC_ADAPTERS_DIR adapters");
        }

        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        SignalBus signalBus = new SignalBus();
        FeedbackSignalRegistry signalRegistry = new FeedbackSignalRegistry();
        signalRegistry.load(config.getSignalsDir());
        FeedbackSignalEmitter emitter = new FeedbackSignalEmitter(
                new CompositeSpine(List.of(new MeterRegistrySpine(meterRegistry), signalBus)), signalRegistry);

        ExecutionLedger ledger;
        try {
            ledger = ExecutionLedger.create(config);
        } catch (RuntimeException e) {
            log.warn("Execution ledger using in-memory store: could not initialize JDBC store ({}). Execution continues.",
                    e.getMessage());
            ledger = new ExecutionLedger(new InMemoryExecutionStore());
        }

        FeatureRegistry features = FeatureRegistry.getInstance();
        List<String> featureNames = new ArrayList<>();
        registerFeature(features, new MetricsFeature(meterRegistry), "metrics", featureNames);
        registerFeature(features, new LedgerFeature(ledger), "ledger", featureNames);
        registerFeature(features, new SignalEmissionFeature(emitter), "signals", featureNames);

        UnitInvoker invoker = new UnitInvoker(unitRegistry, new UnitFeatureRunner(features), tenantConfigs);
        IntentEngine engine = config.getIntentEngine() == FabricConfig.IntentEngineMode.INPROCESS
                ? new InProcessIntentEngine(invoker, ledger, executor)
                : null;
        IntentHandler intentHandler = new IntentHandler(engine);
        log.info("Intent handler ready: {} intent(s), engine={}", intentHandler.getIntentCount(),
                config.getIntentEngine());

        CapabilityProvider capabilities = new CapabilityProvider();
        Map<String, Boolean> provided = capabilities.provideAllCapabilities();
        log.info("Capability profiles declared: {}", provided.size());

        InMemoryAssetRegistryClient registryClient = new InMemoryAssetRegistryClient();
        RegistryCardLoader cardLoader = new RegistryCardLoader(registryClient, config.getCardsDir());
        cardLoader.loadAll();

        RateLimiter rateLimiter = RateLimiter.create(config, tenantConfigs);
        DataFabricGateway gateway = new DataFabricGateway(registryClient, intentHandler, ledger, rateLimiter, signalBus);

        log.info("Data fabric worker initialized | tenants: {} | units: {} | cards: {} | signals: {}",
                tenantIds, units, cardLoader.getCardCount(), signalRegistry.getAll().size());
        return new BootstrapContext(config, tenantIds, tenantConfigs, configuredTenants, ports, unitRegistry, features, featureNames, ledger,
                meterRegistry, signalRegistry, emitter, signalBus, invoker, intentHandler, capabilities,
                registryClient, cardLoader, rateLimiter, gateway);
    }

    /**
     * Reads the tenant config file and registers each entry's config.
     *
     * @return ids of the tenants found in the file, in file order; empty when no file is configured
     * @throws IllegalStateException when the file cannot be read or is not a JSON array of tenant entries
     */
    static List<String> loadTenantConfig(String file, TenantConfigRegistry registry) {
        if (file == null || file.isBlank()) {
            return List.of();
        }
        List<TenantEntry> entries;
        try {
            entries = TenantEntry.parse(Files.readString(Path.of(file), StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Tenant config could not be loaded from " + file + ": " + e.getMessage(), e);
        }
        List<String> ids = new ArrayList<>();
        for (TenantEntry entry : entries) {
            registry.put(entry.getId(), entry.getConfig());
            ids.add(entry.getId());
        }
        log.info("Tenant config loaded from {}: {} tenant(s)", file, ids.size());
        return ids;
    }

    private static void registerFeature(FeatureRegistry registry, Object feature, String name, List<String> names) {
        registry.register(feature);
        names.add(name);
        log.info("Registered feature {}", name);
    }
}

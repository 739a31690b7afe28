package com.aiverse.fabric.worker.bootstrap;

import com.aiverse.fabric.annotations.ResourceCleanup;
import com.aiverse.fabric.config.FabricConfig;
import com.aiverse.fabric.config.TenantConfigRegistry;
import com.aiverse.fabric.features.FeatureRegistry;
import com.aiverse.fabric.ledger.ExecutionLedger;
import com.aiverse.fabric.mcop.CapabilityProvider;
import com.aiverse.fabric.mcop.InMemoryAssetRegistryClient;
import com.aiverse.fabric.mcop.IntentHandler;
import com.aiverse.fabric.mcop.RegistryCardLoader;
import com.aiverse.fabric.ratelimit.RateLimiter;
import com.aiverse.fabric.signals.FeedbackSignalEmitter;
import com.aiverse.fabric.signals.FeedbackSignalRegistry;
import com.aiverse.fabric.signals.SignalBus;
import com.aiverse.fabric.unit.PortBindings;
import com.aiverse.fabric.unit.UnitRegistry;
import com.aiverse.fabric.worker.api.DataFabricGateway;
import com.aiverse.fabric.worker.engine.UnitInvoker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Everything {@link FabricBootstrap#initialize} wired together. Holds the worker's registries and services
 * until {@link #shutdown()}; {@link #remove()} takes the plugin out of the process entirely.
 */
public final class BootstrapContext {

    private static final Logger log = LoggerFactory.getLogger(BootstrapContext.class);

    private final FabricConfig config;
    private final List<String> tenantIds;
    private final TenantConfigRegistry tenantConfigs;
    private final List<String> configuredTenants;
    private final PortBindings portBindings;
    private final UnitRegistry unitRegistry;
    private final FeatureRegistry featureRegistry;
    private final List<String> featureNames;
    private final ExecutionLedger ledger;
    private final MeterRegistry meterRegistry;
    private final FeedbackSignalRegistry signalRegistry;
    private final FeedbackSignalEmitter signalEmitter;
    private final SignalBus signalBus;
    private final UnitInvoker unitInvoker;
    private final IntentHandler intentHandler;
    private final CapabilityProvider capabilityProvider;
    private final InMemoryAssetRegistryClient registryClient;
    private final RegistryCardLoader cardLoader;
    private final RateLimiter rateLimiter;
    private final DataFabricGateway gateway;

    BootstrapContext(FabricConfig config, List<String> tenantIds, TenantConfigRegistry tenantConfigs,
                     List<String> configuredTenants, PortBindings portBindings, UnitRegistry unitRegistry,
                     FeatureRegistry featureRegistry, List<String> featureNames, ExecutionLedger ledger,
                     MeterRegistry meterRegistry, FeedbackSignalRegistry signalRegistry,
                     FeedbackSignalEmitter signalEmitter, SignalBus signalBus, UnitInvoker unitInvoker,
                     IntentHandler intentHandler, CapabilityProvider capabilityProvider,
                     InMemoryAssetRegistryClient registryClient, RegistryCardLoader cardLoader,
                     RateLimiter rateLimiter, DataFabricGateway gateway) {
        this.config = config;
        this.tenantIds = List.copyOf(tenantIds);
        this.tenantConfigs = tenantConfigs;
        this.configuredTenants = List.copyOf(configuredTenants);
        this.portBindings = portBindings;
        this.unitRegistry = unitRegistry;
        this.featureRegistry = featureRegistry;
        this.featureNames = List.copyOf(featureNames);
        this.ledger = ledger;
        this.meterRegistry = meterRegistry;
        this.signalRegistry = signalRegistry;
        this.signalEmitter = signalEmitter;
        this.signalBus = signalBus;
        this.unitInvoker = unitInvoker;
        this.intentHandler = intentHandler;
        this.capabilityProvider = capabilityProvider;
        this.registryClient = registryClient;
        this.cardLoader = cardLoader;
        this.rateLimiter = rateLimiter;
        this.gateway = gateway;
    }

    /** Tenants whose config was loaded from the tenant config file. */
    public List<String> getConfiguredTenants() {
        return configuredTenants;
    }

    public FabricConfig getConfig() {
        return config;
    }

    /** Tenants units were registered for. */
    public List<String> getTenantIds() {
        return tenantIds;
    }

    public PortBindings getPortBindings() {
        return portBindings;
    }

    public UnitRegistry getUnitRegistry() {
        return unitRegistry;
    }

    public FeatureRegistry getFeatureRegistry() {
        return featureRegistry;
    }

    public ExecutionLedger getLedger() {
        return ledger;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public FeedbackSignalRegistry getSignalRegistry() {
        return signalRegistry;
    }

    public FeedbackSignalEmitter getSignalEmitter() {
        return signalEmitter;
    }

    public SignalBus getSignalBus() {
        return signalBus;
    }

    public UnitInvoker getUnitInvoker() {
        return unitInvoker;
    }

    public IntentHandler getIntentHandler() {
        return intentHandler;
    }

    public CapabilityProvider getCapabilityProvider() {
        return capabilityProvider;
    }

    public InMemoryAssetRegistryClient getRegistryClient() {
        return registryClient;
    }

    public RegistryCardLoader getCardLoader() {
        return cardLoader;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public DataFabricGateway getGateway() {
        return gateway;
    }

    /**
     * Calls {@link ResourceCleanup#onExit()} on every registered unit and feature that implements it and closes the
     * rate limiter's counter store. Failures are logged so the remaining components still get cleaned up.
     */
    public void shutdown() {
        for (Map<String, UnitRegistry.UnitEntry> byId : unitRegistry.getAllByTenant().values()) {
            for (UnitRegistry.UnitEntry e : byId.values()) {
                if (e.getUnit() instanceof ResourceCleanup cleanup) {
                    try {
                        cleanup.onExit();
                    } catch (Exception ex) {
                        log.warn("Unit {} onExit failed: {}", e.getId(), ex.getMessage());
                    }
                }
            }
        }
        for (FeatureRegistry.FeatureEntry e : featureRegistry.getAll().values()) {
            if (e.getInstance() instanceof ResourceCleanup cleanup) {
                try {
                    cleanup.onExit();
                } catch (Exception ex) {
                    log.warn("Feature {} onExit failed: {}", e.getName(), ex.getMessage());
                }
            }
        }
        closeRateLimiter();
    }

    private void closeRateLimiter() {
        try {
            rateLimiter.close();
        } catch (RuntimeException e) {
            log.warn("Rate limiter close failed: {}", e.getMessage());
        }
    }

    /**
     * Removes the plugin from the process: unregisters its capability cards, units and features, drops signal
     * subscriptions and emission history, drops the tenant config it loaded, closes the rate limiter's counter
     * store and clears the port bindings.
     */
    public void remove() {
        Map<String, Boolean> unloaded = cardLoader.unloadAll();
        int units = 0;
        for (String tenantId : tenantIds) {
            for (String unitId : unitRegistry.listUnitIds(tenantId)) {
                if (unitRegistry.unregister(tenantId, unitId)) units++;
            }
        }
        for (String name : featureNames) {
            featureRegistry.unregister(name);
        }
        signalBus.clear();
        signalEmitter.clear();
        signalRegistry.clear();
        for (String tenantId : configuredTenants) {
            tenantConfigs.remove(tenantId);
        }
        closeRateLimiter();
        portBindings.clear();
        log.info("Data fabric removed: {} card(s) unregistered, {} unit registration(s) removed, {} feature(s) removed",
                unloaded.size(), units, featureNames.size());
    }
}

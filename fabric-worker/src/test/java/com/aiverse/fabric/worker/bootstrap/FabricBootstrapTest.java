package com.aiverse.fabric.worker.bootstrap;

import com.aiverse.fabric.config.FabricConfig;
import com.aiverse.fabric.config.TenantConfig;
import com.aiverse.fabric.config.TenantConfigRegistry;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.features.FeatureRegistry;
import com.aiverse.fabric.ledger.InMemoryExecutionStore;
import com.aiverse.fabric.mcop.CapabilityProfile;
import com.aiverse.fabric.ratelimit.RateClass;
import com.aiverse.fabric.signals.FeedbackSignal;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitProvider;
import com.aiverse.fabric.unit.UnitRegistry;
import com.aiverse.fabric.units.InternalUnits;
import com.aiverse.fabric.worker.WorkerTestPorts;
import com.aiverse.fabric.worker.api.ErrorCode;
import com.aiverse.fabric.worker.api.FabricApiException;
import com.aiverse.fabric.worker.api.IntentSubmission;
import com.aiverse.fabric.worker.api.IntentSubmissionResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FabricBootstrapTest {

    private final WorkerTestPorts ports = new WorkerTestPorts();
    private final TenantContext tenant = WorkerTestPorts.newTenant();
    private BootstrapContext ctx;

    @AfterEach
    void tearDown() {
        if (ctx != null) ctx.remove();
        UnitRegistry.getInstance().clear();
        FeatureRegistry.getInstance().clear();
        TenantConfigRegistry.getInstance().clear();
    }

    private BootstrapContext start(FabricConfig config) {
        ctx = FabricBootstrap.initialize(config, List.of(ports.provider()), null);
        return ctx;
    }

    private static Map<String, Object> registration() {
        return Map.of(
                "asset_declaration", Map.of(
                        "asset_type", "dataset",
                        "name", "orders",
                        "version", "1.0.0",
                        "storage_location_ref", "s3://lake/orders",
                        "classification", "internal",
                        "data_format", "parquet"),
                "owner_ref", UUID.randomUUID().toString());
    }

    @Test
    void initialize_registersUnitsWhosePortsAreBound() {
        start(FabricConfig.builder().build());

        assertEquals(List.of("default"), ctx.getTenantIds());
        List<String> unitIds = ctx.getUnitRegistry().listUnitIds("default");
        assertEquals(2, unitIds.size());
        assertTrue(unitIds.containsAll(List.of("DataAssetRegistrar", "DataProfiler")));
        assertEquals(3, ctx.getFeatureRegistry().size());
        assertEquals(22, ctx.getCardLoader().getCardCount());
        assertEquals(22, ctx.getRegistryClient().size());
        assertFalse(ctx.getSignalRegistry().getAll().isEmpty());
        assertNotNull(ctx.getGateway());
    }

    @Test
    void initialize_registersPerConfiguredTenant() {
        start(FabricConfig.builder().tenantIds(List.of("acme", "globex")).build());

        assertEquals(2, ctx.getUnitRegistry().listUnitIds("acme").size());
        assertEquals(2, ctx.getUnitRegistry().listUnitIds("globex").size());
        assertTrue(ctx.getUnitRegistry().listUnitIds("default").isEmpty());
    }

    @Test
    void submittedIntentsRunThroughUnitsLedgerAndSignals() {
        start(FabricConfig.builder().build());
        List<FeedbackSignal> signals = new ArrayList<>();
        ctx.getGateway().subscribe(tenant, null, signals::add);

        IntentSubmissionResponse registered = ctx.getGateway().submitIntent(
                new IntentSubmission("data-fabric", "RegisterDataAsset", registration(), tenant, "trace-1"));
        IntentSubmissionResponse profiled = ctx.getGateway().submitIntent(
                new IntentSubmission("data_fabric", "ProfileData", Map.of("dataset_ref", "orders@1", "sample_size", 500),
                        tenant, null));

        assertEquals("succeeded", registered.status());
        assertEquals("succeeded", profiled.status());
        assertEquals(List.of("orders:1.0.0"), ports.registry.created);

        Map<String, Object> execution = ctx.getGateway().getExecution(profiled.executionId(), tenant);
        Map<?, ?> unit = (Map<?, ?>) ((List<?>) execution.get("units")).get(0);
        assertEquals("DataProfiler", unit.get("unit_id"));
        assertEquals(Boolean.TRUE, unit.get("succeeded"));
        assertNotNull(((Map<?, ?>) unit.get("output")).get("result"));

        assertEquals(1, signals.size());
        assertEquals("DataProfileDriftAdvisor", signals.get(0).name());
        assertEquals(profiled.intentId(), signals.get(0).payload().get("intent_id"));

        assertEquals(2.0, ctx.getMeterRegistry().find("fabric.unit.executions").counters().stream()
                .mapToDouble(c -> c.count()).sum());
    }

    @Test
    void failedUnitMarksExecutionFailed() {
        start(FabricConfig.builder().build());
        ports.profiles.failure = PortFailure.TIMEOUT;

        IntentSubmissionResponse response = ctx.getGateway().submitIntent(
                new IntentSubmission("data-fabric", "ProfileData", Map.of("dataset_ref", "orders@1"), tenant, null));

        assertEquals("failed", response.status());
        Map<String, Object> execution = ctx.getGateway().getExecution(response.executionId(), tenant);
        assertEquals("DataProfiler: PROFILE_TIMEOUT Profiling timed out", execution.get("error_message"));
    }

    @Test
    void withoutEngineExecutionsStaySubmitted() {
        start(FabricConfig.builder().intentEngine(FabricConfig.IntentEngineMode.NONE).build());

        IntentSubmissionResponse response = ctx.getGateway().submitIntent(
                new IntentSubmission("data-fabric", "ProfileData", Map.of("dataset_ref", "d"), tenant, null));

        assertEquals("submitted", response.status());
        Map<String, Object> execution = ctx.getGateway().getExecution(response.executionId(), tenant);
        assertEquals("submitted", execution.get("status"));
        assertEquals(List.of(), execution.get("units"));
        assertTrue(ports.profiles.depths.isEmpty());
    }

    @Test
    void unreachableDatabaseFallsBackToInMemoryLedger() {
        start(FabricConfig.builder()
                .ledgerStore(FabricConfig.LedgerStore.JDBC)
                .dbHost("127.0.0.1")
                .dbPort(1)
                .build());

        assertInstanceOf(InMemoryExecutionStore.class, ctx.getLedger().getStore());
    }

    @Test
    void missingCardsDirectoryRegistersNoCards(@TempDir Path tmp) {
        start(FabricConfig.builder().cardsDir(tmp.resolve("absent").toString()).build());

        assertEquals(0, ctx.getCardLoader().getCardCount());
        assertTrue(ctx.getGateway().getCapabilities("data-fabric", tenant).isEmpty());
    }

    @Test
    void remove_leavesNoResidue() {
        start(FabricConfig.builder().tenantIds(List.of("acme")).build());
        ctx.getGateway().subscribe(tenant, null, s -> { });
        ctx.getGateway().submitIntent(
                new IntentSubmission("data-fabric", "ProfileData", Map.of("dataset_ref", "d"), tenant, null));
        assertEquals(1, ctx.getRateLimiter().currentUsage(tenant.tenantId(), RateClass.COMPUTE));

        ctx.remove();

        assertTrue(ctx.getUnitRegistry().listUnitIds("acme").isEmpty());
        assertEquals(0, ctx.getFeatureRegistry().size());
        assertEquals(0, ctx.getRegistryClient().size());
        assertEquals(0, ctx.getCardLoader().getCardCount());
        assertEquals(0, ctx.getSignalBus().getSubscriptionCount());
        assertTrue(ctx.getSignalEmitter().getEmissions().isEmpty());
        assertTrue(ctx.getSignalRegistry().getAll().isEmpty());
        assertTrue(ctx.getPortBindings().boundTypes().isEmpty());
        assertEquals(0, ctx.getRateLimiter().currentUsage(tenant.tenantId(), RateClass.COMPUTE));
        ctx = null;
    }

    @Test
    void unitCapabilityTypesMatchAdvertisedProfiles() {
        start(FabricConfig.builder().build());

        assertEquals(InternalUnits.providers().size(), ctx.getCapabilityProvider().getCapabilityCount());
        for (UnitProvider provider : InternalUnits.providers()) {
            CapabilityProfile profile = ctx.getCapabilityProvider().getCapabilityProfile(provider.getUnitId());
            assertNotNull(profile, provider.getUnitId());
            assertEquals(provider.getCapabilityType(), profile.capabilityType(), provider.getUnitId());
        }
    }

    @Test
    void tenantConfigFile_overridesRateLimitsAndExtendsTenants(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tenants.json");
        Files.writeString(file, "[{\"id\":\"" + tenant.tenantId() + "\",\"name\":\"Acme\","
                + "\"config\":{\"rateLimits\":{\"compute\":1}}}]");
        start(FabricConfig.builder().tenantConfigFile(file.toString()).build());

        assertEquals(List.of("default", tenant.tenantId()), ctx.getTenantIds());
        assertEquals(List.of(tenant.tenantId()), ctx.getConfiguredTenants());
        assertEquals(2, ctx.getUnitRegistry().listUnitIds(tenant.tenantId()).size());
        assertEquals(1, ctx.getRateLimiter().limitFor(tenant.tenantId(), RateClass.COMPUTE));
        assertEquals(50, ctx.getRateLimiter().limitFor("default", RateClass.COMPUTE));

        IntentSubmission profile = new IntentSubmission("data-fabric", "ProfileData",
                Map.of("dataset_ref", "orders@1"), tenant, null);
        assertEquals("succeeded", ctx.getGateway().submitIntent(profile).status());
        FabricApiException e = assertThrows(FabricApiException.class, () -> ctx.getGateway().submitIntent(profile));
        assertEquals(ErrorCode.RATE_LIMITED, e.getCode());
        assertEquals(1L, e.getDetails().get("limit"));

        ctx.remove();
        ctx = null;
        assertSame(TenantConfig.EMPTY, TenantConfigRegistry.getInstance().get(tenant.tenantId()));
    }

    @Test
    void unreadableTenantConfigFileAbortsStartup(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tenants.json");
        Files.writeString(file, "{\"id\":\"acme\"}");

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> start(FabricConfig.builder().tenantConfigFile(file.toString()).build()));
        assertTrue(e.getMessage().contains("must be a JSON array"), e.getMessage());
        assertThrows(IllegalStateException.class,
                () -> start(FabricConfig.builder().tenantConfigFile(dir.resolve("missing.json").toString()).build()));
    }
}

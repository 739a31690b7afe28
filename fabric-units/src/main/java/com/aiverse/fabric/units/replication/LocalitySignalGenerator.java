package com.aiverse.fabric.units.replication;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.LocalityType;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.replication.LocalityResult;
import com.aiverse.fabric.contracts.replication.LocalitySignal;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.AssetRegistry;
import com.aiverse.fabric.unit.port.EnvironmentDiscovery;
import com.aiverse.fabric.unit.port.LocalityProber;
import com.aiverse.fabric.unit.port.LocalityProber.ProbedLocality;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Produces data locality hints for the scheduler. Signals below {@value #STALE_CONFIDENCE} confidence mark the
 * output as stale; an unreachable location yields a partial result with a single unavailable signal.
 */
@FabricUnit(id = "LocalitySignalGenerator", capabilityType = "locality-signaling",
        description = "Generates data locality signals for scheduling",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "read-probe",
        tags = {"locality", "scheduling", "stateless"})
public final class LocalitySignalGenerator extends TypedExecutionUnit<LocalitySignalGenerator.Input, LocalityResult> {

    public static final double STALE_CONFIDENCE = 0.5;

    public record Input(@JsonProperty("asset_ref") String assetRef) {
        public Input {
            Objects.requireNonNull(assetRef, "asset_ref");
        }
    }

    private final AssetRegistry assetRegistry;
    private final LocalityProber localityProber;
    private final EnvironmentDiscovery environmentDiscovery;

    public LocalitySignalGenerator(AssetRegistry assetRegistry, LocalityProber localityProber,
                                   EnvironmentDiscovery environmentDiscovery) {
        super(Input.class);
        this.assetRegistry = Objects.requireNonNull(assetRegistry, "assetRegistry");
        this.localityProber = Objects.requireNonNull(localityProber, "localityProber");
        this.environmentDiscovery = Objects.requireNonNull(environmentDiscovery, "environmentDiscovery");
    }

    @Override
    public UnitOutput<LocalityResult> run(Input input, TenantContext tenant) throws PortException {
        Map<String, Object> asset = assetRegistry.getAsset(input.assetRef(), tenant);
        if (asset == null) {
            return UnitOutput.failure("ASSET_NOT_FOUND", "Asset not found: " + input.assetRef());
        }

        List<String> locations = storageLocations(asset);
        if (locations.isEmpty()) {
            return UnitOutput.success(new LocalityResult(List.of(), Instant.now()));
        }

        List<String> environments = environmentDiscovery.getEnvironments(tenant);

        List<ProbedLocality> probed;
        try {
            probed = localityProber.probeLocality(locations, environments);
        } catch (PortException e) {
            return switch (e.failure()) {
                case UNREACHABLE -> {
                    LocalitySignal unavailable = new LocalitySignal(e.subject(), LocalityType.UNAVAILABLE, -1.0, 0.0);
                    yield UnitOutput.partial(new LocalityResult(List.of(unavailable), Instant.now()),
                            "Partial result: " + e.getMessage()).withStaleSignals(true);
                }
                case TIMEOUT -> UnitOutput.<LocalityResult>failure("PROBE_TIMEOUT", "Locality probe timed out")
                        .withStaleSignals(true);
                default -> throw e;
            };
        }

        List<LocalitySignal> signals = new ArrayList<>(probed.size());
        boolean stale = false;
        for (ProbedLocality p : probed) {
            signals.add(new LocalitySignal(p.environmentId(), LocalityType.fromValue(p.localityType()),
                    p.transferCost(), p.confidence()));
            stale |= p.confidence() < STALE_CONFIDENCE;
        }
        return UnitOutput.success(new LocalityResult(signals, Instant.now())).withStaleSignals(stale);
    }

    private static List<String> storageLocations(Map<String, Object> asset) {
        Object raw = asset.get("storage_locations");
        if (!(raw instanceof List<?> list)) return List.of();
        List<String> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (o != null) out.add(o.toString());
        }
        return out;
    }
}

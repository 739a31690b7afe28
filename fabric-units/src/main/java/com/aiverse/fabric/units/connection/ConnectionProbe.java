package com.aiverse.fabric.units.connection;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.HealthStatus;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.connection.ConnectionProbeInput;
import com.aiverse.fabric.contracts.connection.ConnectionProbeResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.ConnectionDriver;
import com.aiverse.fabric.unit.port.ConnectionDriver.ProbeOutcome;
import com.aiverse.fabric.unit.port.CredentialResolver;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Tests connectivity to an external source. Connection-level failures are reported as an unhealthy result,
 * not as an error; only an unresolvable credential stops the probe.
 */
@FabricUnit(id = "ConnectionProbe", capabilityType = "connection-testing",
        description = "Probes connectivity and latency of a data source connection",
        computeClass = "cpu-small", memoryRequirements = "low", ioPattern = "network-probe",
        tags = {"connection", "health", "stateless"})
public final class ConnectionProbe extends TypedExecutionUnit<ConnectionProbe.Input, ConnectionProbeResult> {

    static final long DEGRADED_LATENCY_MS = 1000;

    public record Input(
            @JsonProperty("probe_input") ConnectionProbeInput probeInput,
            @JsonProperty("connection_config") Map<String, Object> connectionConfig) {

        public Input {
            Objects.requireNonNull(probeInput, "probe_input");
            connectionConfig = Copies.map(connectionConfig);
        }
    }

    private final CredentialResolver credentialResolver;
    private final ConnectionDriver connectionDriver;

    public ConnectionProbe(CredentialResolver credentialResolver, ConnectionDriver connectionDriver) {
        super(Input.class);
        this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
        this.connectionDriver = Objects.requireNonNull(connectionDriver, "connectionDriver");
    }

    @Override
    public UnitOutput<ConnectionProbeResult> run(Input input, TenantContext tenant) throws PortException {
        ConnectionProbeInput probe = input.probeInput();

        Map<String, Object> credentials;
        try {
            credentials = credentialResolver.resolve(probe.credentialRef(), tenant);
        } catch (PortException e) {
            return switch (e.failure()) {
                case UNAVAILABLE, NOT_FOUND, ACCESS_DENIED ->
                        UnitOutput.failure("CREDENTIAL_UNAVAILABLE", "Cannot resolve credential reference");
                default -> throw e;
            };
        }

        ProbeOutcome outcome;
        try {
            outcome = connectionDriver.testConnection(input.connectionConfig(), credentials, probe.timeoutSeconds());
        } catch (PortException e) {
            return switch (e.failure()) {
                case TIMEOUT -> unhealthy(probe.timeoutSeconds() * 1000L, "Connection timeout");
                case AUTHENTICATION -> unhealthy(0, "Authentication failed: " + e.getMessage());
                case NETWORK -> unhealthy(0, "Network error: " + e.getMessage());
                default -> throw e;
            };
        }

        HealthStatus health;
        if (outcome.success()) {
            health = outcome.latencyMs() < DEGRADED_LATENCY_MS ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
        } else {
            health = HealthStatus.UNHEALTHY;
        }
        return UnitOutput.success(new ConnectionProbeResult(health, outcome.latencyMs(), outcome.error(), Instant.now()));
    }

    private static UnitOutput<ConnectionProbeResult> unhealthy(long latencyMs, String details) {
        return UnitOutput.success(new ConnectionProbeResult(HealthStatus.UNHEALTHY, latencyMs, details, Instant.now()));
    }
}

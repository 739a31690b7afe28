package com.aiverse.fabric.worker.engine;

import com.aiverse.fabric.config.FabricConfig;
import com.aiverse.fabric.config.TenantConfigRegistry;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.features.ResolvedFeatures;
import com.aiverse.fabric.features.UnitExecutionContext;
import com.aiverse.fabric.features.UnitFeatureRunner;
import com.aiverse.fabric.ledger.LedgerFeature;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.UnitRegistry;
import com.aiverse.fabric.worker.api.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Invokes one execution unit for a tenant with the feature hooks around it.
 * <p>
 * The unit is looked up under the tenant id first and then under the default tenant. Exceptions never leave
 * the invoker: an input that does not match the unit's contract becomes {@code VALIDATION_FAILED}, any other
 * exception (including an undeclared {@link PortException}) becomes {@code EXECUTION_FAILED}, as does a result
 * that cannot be rendered as a map. Post hooks receive the map form of the output.
 */
public final class UnitInvoker {

    private static final Logger log = LoggerFactory.getLogger(UnitInvoker.class);

    /** Attribute holding the unit input map. */
    public static final String ATTR_INPUT = LedgerFeature.ATTR_INPUT;
    /** Attribute holding the intent id (UUID) the invocation belongs to. */
    public static final String ATTR_INTENT_ID = "intent_id";
    /** Attribute holding the caller's {@link TenantContext}. */
    public static final String ATTR_TENANT = "tenant";

    private final UnitRegistry unitRegistry;
    private final UnitFeatureRunner featureRunner;
    private final TenantConfigRegistry tenantConfigs;

    public UnitInvoker(UnitRegistry unitRegistry, UnitFeatureRunner featureRunner, TenantConfigRegistry tenantConfigs) {
        this.unitRegistry = Objects.requireNonNull(unitRegistry, "unitRegistry");
        this.featureRunner = Objects.requireNonNull(featureRunner, "featureRunner");
        this.tenantConfigs = Objects.requireNonNull(tenantConfigs, "tenantConfigs");
    }

    /** Invokes a unit outside of any intent execution. */
    public UnitInvocation invoke(String unitId, Map<String, Object> inputs, TenantContext tenant) {
        return invoke(unitId, inputs, tenant, null, null, null);
    }

    /**
     * Invokes a unit as part of an intent execution.
     *
     * @param executionId execution the run is recorded under; null when not part of one
     * @param intentType  intent that caused the run; may be null
     * @param intentId    intent id for signal payloads; may be null
     */
    public UnitInvocation invoke(String unitId, Map<String, Object> inputs, TenantContext tenant,
                                 String executionId, String intentType, UUID intentId) {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(tenant, "tenant");
        Map<String, Object> unitInputs = inputs != null ? inputs : Map.of();
        String tenantId = tenant.tenantId();

        UnitRegistry.UnitEntry entry = unitRegistry.get(tenantId, unitId);
        if (entry == null) {
            entry = unitRegistry.get(FabricConfig.normalizeTenantId(null), unitId);
        }
        if (entry == null) {
            log.warn("Execution unit {} is not registered for tenant {}", unitId, tenantId);
            UnitOutput<Object> missing = UnitOutput.failure(ErrorCode.EXECUTION_FAILED.name(),
                    "Execution unit not available: " + unitId);
            return new UnitInvocation(unitId, "", false, missing.errorCode(), missing.errorMessage(), missing.toMap(), 0L);
        }

        Map<String, Object> attributes = new HashMap<>();
        attributes.put(ATTR_INPUT, unitInputs);
        attributes.put(ATTR_TENANT, tenant);
        if (intentId != null) {
            attributes.put(ATTR_INTENT_ID, intentId);
        }
        UnitExecutionContext context;
        ResolvedFeatures resolved;
        try {
            context = new UnitExecutionContext(executionId, intentType, entry.getId(),
                    entry.getCapabilityType(), tenantId, tenantConfigs.get(tenantId).getConfigMap(), attributes);
            resolved = featureRunner.resolve(context);
        } catch (RuntimeException e) {
            log.warn("Unit {} could not be prepared: {}", unitId, e.getMessage(), e);
            UnitOutput<Object> failed = UnitOutput.failure(ErrorCode.EXECUTION_FAILED.name(), messageOf(e));
            return new UnitInvocation(entry.getId(), entry.getCapabilityType(), false, failed.errorCode(),
                    failed.errorMessage(), failed.toMap(), 0L);
        }

        long start = System.nanoTime();
        UnitOutput<?> output;
        try {
            featureRunner.runPre(resolved, context);
            output = entry.getUnit().execute(unitInputs, tenant);
        } catch (IllegalArgumentException e) {
            log.warn("Unit {} rejected its input: {}", unitId, e.getMessage());
            output = UnitOutput.failure(ErrorCode.VALIDATION_FAILED.name(), e.getMessage());
        } catch (PortException e) {
            log.warn("Unit {} failed with undeclared port failure {}: {}", unitId, e.failure(), e.getMessage(), e);
            output = UnitOutput.failure(ErrorCode.EXECUTION_FAILED.name(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unit {} failed: {}", unitId, e.getMessage(), e);
            output = UnitOutput.failure(ErrorCode.EXECUTION_FAILED.name(), messageOf(e));
        }
        if (output == null) {
            output = UnitOutput.failure(ErrorCode.EXECUTION_FAILED.name(), "Unit returned no output");
        }
        long durationMs = (System.nanoTime() - start) / 1_000_000L;

        Map<String, Object> outputMap;
        try {
            outputMap = output.toMap();
        } catch (IllegalArgumentException e) {
            log.warn("Unit {} returned a result that cannot be rendered: {}", unitId, e.getMessage());
            output = UnitOutput.failure(ErrorCode.EXECUTION_FAILED.name(),
                    "Unit result could not be serialized: " + e.getMessage());
            outputMap = output.toMap();
        }
        boolean succeeded = output.isSuccess();
        UnitExecutionContext post = context.withOutcome(succeeded, output.errorCode(), durationMs);
        if (succeeded) {
            featureRunner.runPostSuccess(resolved, post, outputMap);
        } else {
            featureRunner.runPostError(resolved, post, outputMap);
        }
        featureRunner.runFinally(resolved, post, outputMap);

        log.debug("Unit {} for tenant {} finished in {} ms (success={}, errorCode={})",
                unitId, tenantId, durationMs, succeeded, output.errorCode());
        return new UnitInvocation(entry.getId(), entry.getCapabilityType(), succeeded, output.errorCode(),
                output.errorMessage(), outputMap, durationMs);
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

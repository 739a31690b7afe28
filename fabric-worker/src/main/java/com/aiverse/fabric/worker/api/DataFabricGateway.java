package com.aiverse.fabric.worker.api;

import com.aiverse.fabric.contracts.FabricJson;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.ledger.ExecutionLedger;
import com.aiverse.fabric.ledger.ExecutionRecord;
import com.aiverse.fabric.ledger.ExecutionStatus;
import com.aiverse.fabric.mcop.AssetRegistryClient;
import com.aiverse.fabric.mcop.DataFabricIntents;
import com.aiverse.fabric.mcop.IntentHandler;
import com.aiverse.fabric.mcop.IntentHandlingResult;
import com.aiverse.fabric.mcop.McopException;
import com.aiverse.fabric.ratelimit.RateClass;
import com.aiverse.fabric.ratelimit.RateLimitExceededException;
import com.aiverse.fabric.ratelimit.RateLimiter;
import com.aiverse.fabric.signals.FeedbackSignal;
import com.aiverse.fabric.signals.SignalBus;
import com.aiverse.fabric.signals.SignalFilter;
import com.aiverse.fabric.signals.SignalSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Transport-neutral facade of the data-fabric API: capability discovery, intent submission, execution status and
 * signal subscriptions. Every call is counted against the caller's per-minute rate limit for its request class.
 * Failures are raised as {@link FabricApiException}.
 */
public final class DataFabricGateway {

    private static final Logger log = LoggerFactory.getLogger(DataFabricGateway.class);

    public static final String DOMAIN = DataFabricIntents.DOMAIN;
    /** Alternative spelling of the domain accepted on input. */
    public static final String DOMAIN_ALIAS = "data_fabric";

    private static final long POLL_INTERVAL_MS = 50L;

    private static final Map<String, RateClass> INTENT_RATE_CLASSES = Map.ofEntries(
            Map.entry("RegisterDataAsset", RateClass.WRITE),
            Map.entry("IngestData", RateClass.WRITE),
            Map.entry("CommitDataVersion", RateClass.WRITE),
            Map.entry("BranchDataset", RateClass.WRITE),
            Map.entry("CreateLabelTask", RateClass.WRITE),
            Map.entry("ReplicateData", RateClass.WRITE),
            Map.entry("TransformData", RateClass.COMPUTE),
            Map.entry("MaterializeFeatures", RateClass.COMPUTE),
            Map.entry("ProfileData", RateClass.COMPUTE),
            Map.entry("MergeDataBranches", RateClass.COMPUTE));

    private final AssetRegistryClient registryClient;
    private final IntentHandler intentHandler;
    private final ExecutionLedger ledger;
    private final RateLimiter rateLimiter;
    private final SignalBus signalBus;

    public DataFabricGateway(AssetRegistryClient registryClient, IntentHandler intentHandler, ExecutionLedger ledger,
                             RateLimiter rateLimiter, SignalBus signalBus) {
        this.registryClient = Objects.requireNonNull(registryClient, "registryClient");
        this.intentHandler = Objects.requireNonNull(intentHandler, "intentHandler");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.signalBus = Objects.requireNonNull(signalBus, "signalBus");
    }

    /** Rate class of an intent: write for mutations, compute for heavy processing, read for the rest. */
    public static RateClass rateClassFor(String intentType) {
        return INTENT_RATE_CLASSES.getOrDefault(intentType, RateClass.READ);
    }

    /** Registered capability cards of the domain. */
    public List<Map<String, Object>> getCapabilities(String domain, TenantContext tenant) {
        requireTenant(tenant);
        requireDomain(domain);
        acquire(tenant, RateClass.READ);
        try {
            return registryClient.getCapabilitiesByDomain(DOMAIN);
        } catch (McopException e) {
            throw new FabricApiException(ErrorCode.EXECUTION_FAILED, "Capability lookup failed: " + e.getMessage(),
                    Map.of("domain", DOMAIN), e);
        }
    }

    /**
     * Submits an intent from its JSON body {@code {domain, intent, inputs, tenant_context, trace_id}}.
     *
     * @return {@code {intent_id, status, execution_id, trace_id}}
     */
    public Map<String, Object> submitIntent(Map<String, Object> body) {
        IntentSubmission submission;
        try {
            submission = FabricJson.convert(body != null ? body : Map.of(), IntentSubmission.class);
        } catch (IllegalArgumentException e) {
            throw new FabricApiException(ErrorCode.VALIDATION_FAILED, "Invalid intent submission: " + e.getMessage(),
                    Map.of(), e);
        }
        return submitIntent(submission).toMap();
    }

    public IntentSubmissionResponse submitIntent(IntentSubmission submission) {
        Objects.requireNonNull(submission, "submission");
        TenantContext tenant = submission.tenantContext();
        requireTenant(tenant);
        requireDomain(submission.domain());
        String intentType = submission.intent();
        if (!intentHandler.isSupportedIntent(intentType)) {
            throw new FabricApiException(ErrorCode.VALIDATION_FAILED, "Unsupported intent type: " + intentType,
                    Map.of("supported_intents", intentHandler.getSupportedIntents()));
        }
        acquire(tenant, rateClassFor(intentType));

        UUID intentId = UUID.randomUUID();
        UUID executionId = UUID.randomUUID();
        String traceId = submission.traceId() != null && !submission.traceId().isBlank()
                ? submission.traceId() : UUID.randomUUID().toString();
        String exec = executionId.toString();
        ledger.submitted(ExecutionRecord.submitted(exec, intentId.toString(), tenant.tenantId(), intentType, DOMAIN,
                traceId, submission.inputs(), ledger.now()));

        IntentHandlingResult result = intentHandler.handleIntent(intentType, intentId, executionId, tenant,
                submission.inputs());
        if (!result.success()) {
            ledger.ended(exec, ExecutionStatus.FAILED, result.error());
            throw new FabricApiException(ErrorCode.EXECUTION_FAILED, result.error(),
                    Map.of("intent_id", intentId.toString(), "execution_id", exec, "trace_id", traceId));
        }
        ExecutionStatus status = ledger.find(exec).map(ExecutionRecord::status).orElse(ExecutionStatus.SUBMITTED);
        log.info("Intent {} ({}) accepted for tenant {}: execution={} trace={} units={}",
                intentId, intentType, tenant.tenantId(), exec, traceId, result.unitCount());
        return new IntentSubmissionResponse(intentId.toString(), lower(status), exec, traceId);
    }

    /**
     * Execution record with its units and their outputs. Executions of other tenants are reported as not found.
     */
    public Map<String, Object> getExecution(String executionId, TenantContext tenant) {
        requireTenant(tenant);
        acquire(tenant, RateClass.READ);
        return view(findOwned(executionId, tenant));
    }

    /**
     * Waits until the execution reaches a terminal status.
     *
     * @throws FabricApiException {@code TIMEOUT} if it is still running when the timeout elapses
     */
    public Map<String, Object> awaitExecution(String executionId, TenantContext tenant, Duration timeout) {
        requireTenant(tenant);
        acquire(tenant, RateClass.READ);
        Instant deadline = Instant.now().plus(timeout != null ? timeout : Duration.ZERO);
        ExecutionRecord record = findOwned(executionId, tenant);
        while (!record.status().isTerminal()) {
            if (!Instant.now().isBefore(deadline)) {
                throw timeout(executionId, record.status());
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw timeout(executionId, record.status());
            }
            record = findOwned(executionId, tenant);
        }
        return view(record);
    }

    /** Most recent executions of the caller's tenant, newest first, without unit records. */
    public List<Map<String, Object>> listExecutions(TenantContext tenant, int limit) {
        requireTenant(tenant);
        acquire(tenant, RateClass.READ);
        List<Map<String, Object>> out = new ArrayList<>();
        for (ExecutionRecord r : ledger.listByTenant(tenant.tenantId(), limit)) {
            out.add(view(r));
        }
        return out;
    }

    /**
     * Subscribes to feedback signals. Without a tenant filter the subscription is limited to the subscriber's
     * tenant; a filter may only name the subscriber's own tenant or organization.
     */
    public SignalSubscription subscribe(TenantContext subscriber, SignalFilter filter, Consumer<FeedbackSignal> listener) {
        requireTenant(subscriber);
        Objects.requireNonNull(listener, "listener");
        SignalFilter f = filter != null ? filter : SignalFilter.all();
        if (f.domain() != null && !f.domain().isBlank()) {
            requireDomain(f.domain());
        }
        Set<String> own = Set.of(subscriber.tenantId(), subscriber.organizationId().toString());
        for (String t : f.tenantFilter()) {
            if (!own.contains(t)) {
                throw new FabricApiException(ErrorCode.ACCESS_DENIED, "Cannot subscribe to signals of another tenant",
                        Map.of("tenant", t));
            }
        }
        acquire(subscriber, RateClass.READ);
        Set<String> tenants = f.tenantFilter().isEmpty() ? Set.of(subscriber.tenantId()) : f.tenantFilter();
        return signalBus.subscribe(new SignalFilter(f.domain(), f.signalTypes(), tenants), listener);
    }

    public boolean unsubscribe(UUID subscriptionId) {
        return signalBus.unsubscribe(subscriptionId);
    }

    private ExecutionRecord findOwned(String executionId, TenantContext tenant) {
        if (executionId == null || executionId.isBlank()) {
            throw new FabricApiException(ErrorCode.VALIDATION_FAILED, "execution_id is required");
        }
        Optional<ExecutionRecord> found = ledger.find(executionId.trim());
        if (found.isEmpty() || !tenant.tenantId().equals(found.get().tenantId())) {
            throw new FabricApiException(ErrorCode.DATA_NOT_FOUND, "Execution not found: " + executionId,
                    Map.of("execution_id", executionId));
        }
        return found.get();
    }

    private static Map<String, Object> view(ExecutionRecord record) {
        Map<String, Object> m = new LinkedHashMap<>(FabricJson.toMap(record));
        m.put("status", lower(record.status()));
        return m;
    }

    private static FabricApiException timeout(String executionId, ExecutionStatus status) {
        return new FabricApiException(ErrorCode.TIMEOUT, "Execution did not finish in time: " + executionId,
                Map.of("execution_id", executionId, "status", lower(status)));
    }

    private static String lower(ExecutionStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private static void requireTenant(TenantContext tenant) {
        if (tenant == null) {
            throw new FabricApiException(ErrorCode.VALIDATION_FAILED, "tenant_context is required");
        }
    }

    private static void requireDomain(String domain) {
        String d = domain != null ? domain.trim() : "";
        if (!DOMAIN.equals(d) && !DOMAIN_ALIAS.equals(d)) {
            throw new FabricApiException(ErrorCode.VALIDATION_FAILED, "Unknown domain: " + domain,
                    Map.of("supported_domains", List.of(DOMAIN, DOMAIN_ALIAS)));
        }
    }

    private void acquire(TenantContext tenant, RateClass rateClass) {
        try {
            rateLimiter.acquire(tenant.tenantId(), rateClass);
        } catch (RateLimitExceededException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("tenant", e.getTenantId());
            details.put("rate_class", e.getRateClass().value());
            details.put("limit", e.getLimit());
            details.put("usage", e.getUsage());
            throw new FabricApiException(ErrorCode.RATE_LIMITED, e.getMessage(), details, e);
        }
    }
}

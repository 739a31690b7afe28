package com.aiverse.fabric.ledger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local execution store for development and tests.
 */
public final class InMemoryExecutionStore implements ExecutionStore {

    private final Map<String, ExecutionRecord> executions = new ConcurrentHashMap<>();
    private final Map<String, List<UnitRecord>> units = new ConcurrentHashMap<>();

    @Override
    public void executionSubmitted(ExecutionRecord record) {
        if (executions.putIfAbsent(record.executionId(), record) != null) {
            throw new IllegalStateException("Execution already recorded: " + record.executionId());
        }
    }

    @Override
    public void statusChanged(String executionId, ExecutionStatus status, Instant at, String errorMessage) {
        ExecutionRecord updated = executions.computeIfPresent(executionId, (k, r) -> r.withStatus(status, at, errorMessage));
        if (updated == null) {
            throw new IllegalStateException("Unknown execution: " + executionId);
        }
    }

    @Override
    public void unitRecorded(UnitRecord record) {
        units.computeIfAbsent(record.executionId(), k -> new CopyOnWriteArrayList<>()).add(record);
    }

    @Override
    public Optional<ExecutionRecord> find(String executionId) {
        if (executionId == null) return Optional.empty();
        ExecutionRecord r = executions.get(executionId);
        if (r == null) return Optional.empty();
        return Optional.of(r.withUnits(units.getOrDefault(executionId, List.of())));
    }

    @Override
    public List<ExecutionRecord> listByTenant(String tenantId, int limit) {
        List<ExecutionRecord> out = new ArrayList<>();
        for (ExecutionRecord r : executions.values()) {
            if (r.tenantId() != null && r.tenantId().equals(tenantId)) out.add(r);
        }
        out.sort(Comparator.comparing(ExecutionRecord::submittedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return out.size() > limit ? out.subList(0, limit) : out;
    }

    public void clear() {
        executions.clear();
        units.clear();
    }
}

package com.aiverse.fabric.worker.engine;

import com.aiverse.fabric.ledger.ExecutionLedger;
import com.aiverse.fabric.ledger.ExecutionRecord;
import com.aiverse.fabric.ledger.ExecutionStatus;
import com.aiverse.fabric.mcop.IntentDecomposition;
import com.aiverse.fabric.mcop.IntentEngine;
import com.aiverse.fabric.mcop.McopException;
import com.aiverse.fabric.mcop.UnitReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Development intent engine: runs the units of a decomposition one after another in this process and tracks the
 * execution in the ledger. Each unit gets its input from the intent inputs through its input mapping; a failed
 * unit does not stop the ones after it. The final status is SUCCEEDED, FAILED or PARTIAL from the unit outcomes.
 * <p>
 * Runs on the given executor; with a direct executor ({@code Runnable::run}) the execution is finished when
 * {@link #decomposeIntent} returns.
 */
public final class InProcessIntentEngine implements IntentEngine {

    private static final Logger log = LoggerFactory.getLogger(InProcessIntentEngine.class);

    private final UnitInvoker invoker;
    private final ExecutionLedger ledger;
    private final Executor executor;

    public InProcessIntentEngine(UnitInvoker invoker, ExecutionLedger ledger, Executor executor) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.executor = executor != null ? executor : Runnable::run;
    }

    @Override
    public boolean decomposeIntent(IntentDecomposition decomposition) throws McopException {
        String executionId = decomposition.executionId().toString();
        if (ledger.find(executionId).isEmpty()) {
            ledger.submitted(ExecutionRecord.submitted(executionId, decomposition.intentId().toString(),
                    decomposition.tenant().tenantId(), decomposition.intentType(), decomposition.domain(), null,
                    decomposition.inputs(), ledger.now()));
        }
        try {
            executor.execute(() -> run(decomposition));
        } catch (RejectedExecutionException e) {
            ledger.ended(executionId, ExecutionStatus.FAILED, "Intent engine is not accepting work");
            throw new McopException("Intent engine is not accepting work: " + e.getMessage(), e);
        }
        return true;
    }

    void run(IntentDecomposition d) {
        String executionId = d.executionId().toString();
        try {
            ledger.started(executionId);
            int succeeded = 0;
            int failed = 0;
            String firstError = null;
            for (UnitReference unit : d.units()) {
                UnitInvocation r = invoker.invoke(unit.name(), unit.resolveInputs(d.inputs()), d.tenant(),
                        executionId, d.intentType(), d.intentId());
                if (r.succeeded()) {
                    succeeded++;
                } else {
                    failed++;
                    if (firstError == null) {
                        firstError = unit.name() + ": " + r.errorCode()
                                + (r.errorMessage() != null ? " " + r.errorMessage() : "");
                    }
                }
            }
            ExecutionStatus status = ExecutionStatus.fromOutcomes(succeeded, failed);
            ledger.ended(executionId, status, firstError);
            log.info("Execution {} ({}) {}: {} unit(s) succeeded, {} failed",
                    executionId, d.intentType(), status, succeeded, failed);
        } catch (RuntimeException e) {
            log.error("Execution {} ({}) aborted: {}", executionId, d.intentType(), e.getMessage(), e);
            ledger.ended(executionId, ExecutionStatus.FAILED, "Execution aborted: " + e.getMessage());
        }
    }
}

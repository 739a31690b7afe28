package com.aiverse.fabric.units.quality;

import com.aiverse.fabric.annotations.FabricUnit;
import com.aiverse.fabric.contracts.GateResult;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.contracts.quality.QualityGateInput;
import com.aiverse.fabric.contracts.quality.QualityGateResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.TypedExecutionUnit;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.DatasetReader;
import com.aiverse.fabric.unit.port.QualityEngine;
import com.aiverse.fabric.unit.port.QualityEngine.QualityOutcome;
import com.aiverse.fabric.unit.port.QualityRulesResolver;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/** Evaluates quality rules against thresholds and returns pass or fail with the violations. */
@FabricUnit(id = "QualityGateEvaluator", capabilityType = "quality-evaluation",
        description = "Evaluates a dataset against quality rules and thresholds",
        computeClass = "cpu-medium", memoryRequirements = "medium", ioPattern = "read-evaluate",
        tags = {"quality", "gate", "stateless"})
public final class QualityGateEvaluator extends TypedExecutionUnit<QualityGateEvaluator.Input, QualityGateResult> {

    public record Input(@JsonProperty("gate_input") QualityGateInput gateInput) {
        public Input {
            Objects.requireNonNull(gateInput, "gate_input");
        }
    }

    private final QualityRulesResolver rulesResolver;
    private final DatasetReader datasetReader;
    private final QualityEngine qualityEngine;

    public QualityGateEvaluator(QualityRulesResolver rulesResolver, DatasetReader datasetReader,
                                QualityEngine qualityEngine) {
        super(Input.class);
        this.rulesResolver = Objects.requireNonNull(rulesResolver, "rulesResolver");
        this.datasetReader = Objects.requireNonNull(datasetReader, "datasetReader");
        this.qualityEngine = Objects.requireNonNull(qualityEngine, "qualityEngine");
    }

    @Override
    public UnitOutput<QualityGateResult> run(Input input, TenantContext tenant) throws PortException {
        QualityGateInput in = input.gateInput();

        Map<String, Object> rules;
        try {
            rules = rulesResolver.resolve(in.qualityRulesRef(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.INVALID || e.failure() == PortFailure.NOT_FOUND) {
                return UnitOutput.failure("RULES_INVALID", "Invalid quality rules: " + e.getMessage());
            }
            throw e;
        }

        byte[] dataset;
        try {
            dataset = datasetReader.readDataset(in.datasetRef(), tenant);
        } catch (PortException e) {
            if (e.failure() == PortFailure.READ_FAILURE) {
                return UnitOutput.<QualityGateResult>failure("DATASET_READ_FAILURE",
                        "Failed to read dataset: " + e.getMessage()).withInconclusive(true);
            }
            throw e;
        }

        QualityOutcome outcome;
        try {
            outcome = qualityEngine.evaluate(dataset, rules, in.thresholds());
        } catch (PortException e) {
            if (e.failure() == PortFailure.TIMEOUT) {
                return UnitOutput.<QualityGateResult>failure("EVALUATION_TIMEOUT", "Quality evaluation timed out")
                        .withInconclusive(true);
            }
            throw e;
        }

        GateResult verdict = outcome.passed() ? GateResult.PASS : GateResult.FAIL;
        return UnitOutput.success(new QualityGateResult(verdict, outcome.metricValues(), outcome.violations(),
                Instant.now()));
    }
}

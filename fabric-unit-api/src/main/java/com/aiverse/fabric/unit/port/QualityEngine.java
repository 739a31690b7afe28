package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.quality.QualityViolation;
import com.aiverse.fabric.unit.PortException;

import java.util.List;
import java.util.Map;

public interface QualityEngine {

    /**
     * @throws PortException {@code TIMEOUT}
     */
    QualityOutcome evaluate(byte[] dataset, Map<String, Object> rules, Map<String, Double> thresholds)
            throws PortException;

    record QualityOutcome(boolean passed, Map<String, Double> metricValues, List<QualityViolation> violations) {
        public QualityOutcome {
            metricValues = Copies.map(metricValues);
            violations = Copies.list(violations);
        }
    }
}

package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.unit.PortException;

import java.util.List;
import java.util.Map;

public interface ProfileEngine {

    /**
     * @throws PortException {@code TIMEOUT}
     */
    ProfileOutput computeProfile(byte[] dataset, int sampleSize, String profilingDepth) throws PortException;

    /**
     * {@code columnStats} entries carry {@code column_name, null_count, distinct_count} and optionally
     * {@code min_value, max_value, mean_value}. {@code lowConfidence} is set when the sample was too small.
     */
    record ProfileOutput(List<Map<String, Object>> columnStats, Map<String, Double> qualityScores,
                         List<String> patterns, boolean lowConfidence) {
        public ProfileOutput {
            columnStats = Copies.list(columnStats);
            qualityScores = Copies.map(qualityScores);
            patterns = Copies.list(patterns);
        }
    }
}

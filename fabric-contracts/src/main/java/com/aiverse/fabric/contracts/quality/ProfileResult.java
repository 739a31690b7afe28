package com.aiverse.fabric.contracts.quality;

import com.aiverse.fabric.contracts.Copies;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ProfileResult(
        @JsonProperty("column_stats") List<ColumnStatistics> columnStats,
        @JsonProperty("quality_scores") Map<String, Double> qualityScores,
        @JsonProperty("detected_patterns") List<String> detectedPatterns,
        @JsonProperty("profiled_at") Instant profiledAt) {

    public ProfileResult {
        columnStats = Copies.list(columnStats);
        qualityScores = Copies.map(qualityScores);
        detectedPatterns = Copies.list(detectedPatterns);
    }
}

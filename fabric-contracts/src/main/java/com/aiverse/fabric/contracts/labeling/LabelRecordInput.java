package com.aiverse.fabric.contracts.labeling;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

public record LabelRecordInput(
        @JsonProperty("task_ref") String taskRef,
        @JsonProperty("sample_id") String sampleId,
        @JsonProperty("label_value") Object labelValue,
        @JsonProperty("annotator_ref") UUID annotatorRef) {

    public LabelRecordInput {
        Objects.requireNonNull(taskRef, "task_ref");
        Objects.requireNonNull(sampleId, "sample_id");
        Objects.requireNonNull(annotatorRef, "annotator_ref");
    }
}

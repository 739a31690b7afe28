package com.aiverse.fabric.unit;

import com.aiverse.fabric.contracts.FabricJson;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one unit execution: a result or an error code with message, plus the unit-specific
 * quality flags. Failures are values; a unit returns a failure rather than throwing for every mode it declares.
 * <p>
 * A result may be accompanied by an error message with no error code (partial result). Such an output is
 * still a success.
 *
 * @param <R> result record type
 */
public final class UnitOutput<R> {

    private final R result;
    private final String errorCode;
    private final String errorMessage;
    private final boolean truncated;
    private final boolean lowConfidence;
    private final boolean inconclusive;
    private final boolean staleSignals;

    private UnitOutput(R result, String errorCode, String errorMessage,
                       boolean truncated, boolean lowConfidence, boolean inconclusive, boolean staleSignals) {
        this.result = result;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.truncated = truncated;
        this.lowConfidence = lowConfidence;
        this.inconclusive = inconclusive;
        this.staleSignals = staleSignals;
    }

    public static <R> UnitOutput<R> success(R result) {
        return new UnitOutput<>(result, null, null, false, false, false, false);
    }

    /** Result accompanied by a message describing what is missing from it. */
    public static <R> UnitOutput<R> partial(R result, String message) {
        return new UnitOutput<>(result, null, message, false, false, false, false);
    }

    public static <R> UnitOutput<R> failure(String errorCode, String errorMessage) {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode must be non-blank");
        }
        return new UnitOutput<>(null, errorCode, errorMessage, false, false, false, false);
    }

    public UnitOutput<R> withTruncated(boolean value) {
        return new UnitOutput<>(result, errorCode, errorMessage, value, lowConfidence, inconclusive, staleSignals);
    }

    public UnitOutput<R> withLowConfidence(boolean value) {
        return new UnitOutput<>(result, errorCode, errorMessage, truncated, value, inconclusive, staleSignals);
    }

    public UnitOutput<R> withInconclusive(boolean value) {
        return new UnitOutput<>(result, errorCode, errorMessage, truncated, lowConfidence, value, staleSignals);
    }

    public UnitOutput<R> withStaleSignals(boolean value) {
        return new UnitOutput<>(result, errorCode, errorMessage, truncated, lowConfidence, inconclusive, value);
    }

    public R result() {
        return result;
    }

    public String errorCode() {
        return errorCode;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    public boolean isInconclusive() {
        return inconclusive;
    }

    public boolean hasStaleSignals() {
        return staleSignals;
    }

    /** True when no error code is set. */
    public boolean isSuccess() {
        return errorCode == null;
    }

    /** JSON view with snake_case keys; the result is rendered as a map of its properties. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("result", result != null ? FabricJson.toMap(result) : null);
        out.put("error_code", errorCode);
        out.put("error_message", errorMessage);
        out.put("is_truncated", truncated);
        out.put("low_confidence", lowConfidence);
        out.put("is_inconclusive", inconclusive);
        out.put("has_stale_signals", staleSignals);
        return out;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "UnitOutput{result=" + result + (errorMessage != null ? ", message=" + errorMessage : "") + "}"
                : "UnitOutput{errorCode=" + errorCode + ", errorMessage=" + errorMessage + "}";
    }
}

package com.aiverse.fabric.worker.api;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.FabricJson;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Failure of an API operation. Rendered as {@code {"error": {"code", "message", "details"}}}.
 */
public class FabricApiException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    public FabricApiException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public FabricApiException(ErrorCode code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    public FabricApiException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.details = Copies.map(details);
    }

    public ErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /** Error envelope. */
    public Map<String, Object> toMap() {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code.name());
        error.put("message", getMessage());
        error.put("details", details);
        return Map.of("error", error);
    }

    public String toJson() {
        return FabricJson.toJson(toMap());
    }
}

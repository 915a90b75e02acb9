package com.gpupool.request;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full validation of a hypothesis, intended to run alongside others in one bulk call.
 *
 * @param values Hypothesis parameters
 */
public record BatchValidation(Map<String, Double> values) implements ValidationRequest {

    public BatchValidation {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    @Override
    public RequestKind kind() {
        return RequestKind.BATCH_VALIDATION;
    }

    @Override
    public Map<String, Object> parameters() {
        return new LinkedHashMap<>(values);
    }
}

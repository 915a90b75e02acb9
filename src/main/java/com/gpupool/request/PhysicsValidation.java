package com.gpupool.request;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quick physics and economics check of a hypothesis.
 *
 * @param values Hypothesis parameters (efficiency, cost, capacityKw, ...)
 */
public record PhysicsValidation(Map<String, Double> values) implements ValidationRequest {

    public PhysicsValidation {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    @Override
    public RequestKind kind() {
        return RequestKind.PHYSICS_VALIDATION;
    }

    @Override
    public Map<String, Object> parameters() {
        return new LinkedHashMap<>(values);
    }
}

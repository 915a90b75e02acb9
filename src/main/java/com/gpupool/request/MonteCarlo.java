package com.gpupool.request;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Monte Carlo uncertainty run over the hypothesis parameters.
 *
 * @param values     Distribution means/deviations
 * @param iterations Number of samples
 */
public record MonteCarlo(Map<String, Double> values, int iterations) implements ValidationRequest {

    public static final int DEFAULT_ITERATIONS = 10_000;

    public MonteCarlo {
        values = values == null ? Map.of() : Map.copyOf(values);
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
    }

    public MonteCarlo(Map<String, Double> values) {
        this(values, DEFAULT_ITERATIONS);
    }

    @Override
    public RequestKind kind() {
        return RequestKind.MONTE_CARLO;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("values", values);
        view.put("iterations", iterations);
        return view;
    }
}

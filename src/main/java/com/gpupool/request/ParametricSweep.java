package com.gpupool.request;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sweep one parameter across a range while holding the others at a baseline.
 *
 * @param parameter Swept parameter name
 * @param from      Range start
 * @param to        Range end
 * @param steps     Number of points
 * @param baseline  Values of the other parameters
 */
public record ParametricSweep(
        String parameter,
        double from,
        double to,
        int steps,
        Map<String, Double> baseline
) implements ValidationRequest {

    public ParametricSweep {
        if (parameter == null || parameter.isBlank()) {
            throw new IllegalArgumentException("Swept parameter cannot be blank");
        }
        if (steps < 2) {
            throw new IllegalArgumentException("A sweep needs at least 2 steps");
        }
        baseline = baseline == null ? Map.of() : Map.copyOf(baseline);
    }

    @Override
    public RequestKind kind() {
        return RequestKind.PARAMETRIC_SWEEP;
    }

    /**
     * Baseline values and sweep settings sit under separate keys, so no baseline name can
     * shadow a sweep setting.
     */
    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> sweep = new LinkedHashMap<>();
        sweep.put("parameter", parameter);
        sweep.put("from", from);
        sweep.put("to", to);
        sweep.put("steps", steps);
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("baseline", baseline);
        view.put("sweep", sweep);
        return view;
    }
}

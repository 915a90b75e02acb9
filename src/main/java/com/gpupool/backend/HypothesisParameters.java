package com.gpupool.backend;

import com.gpupool.request.BatchValidation;
import com.gpupool.request.MonteCarlo;
import com.gpupool.request.ParametricSweep;
import com.gpupool.request.PhysicsValidation;
import com.gpupool.request.ValidationRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hypothesis parameters with the defaults the GPU validation functions assume.
 * Keys follow the hypothesis naming (efficiency, costStd, ...); {@link #toWire()} maps
 * them to the names the remote functions expect.
 */
public record HypothesisParameters(
        double efficiency,
        double efficiencyStd,
        double cost,
        double costStd,
        double capacityKw,
        double capacityFactor,
        double lifetimeYears,
        double theoreticalMaxEfficiency,
        double targetLcoe
) {
    private static final Map<String, String> WIRE_NAMES = Map.of(
            "efficiency", "efficiency_mean",
            "efficiencyStd", "efficiency_std",
            "cost", "cost_mean",
            "costStd", "cost_std",
            "capacityKw", "capacity_kw",
            "capacityFactor", "capacity_factor",
            "lifetime", "lifetime_years",
            "theoreticalMaxEfficiency", "theoretical_max_efficiency",
            "targetLcoe", "target_lcoe"
    );

    public static HypothesisParameters from(Map<String, Double> values) {
        return new HypothesisParameters(
                values.getOrDefault("efficiency", 0.35),
                values.getOrDefault("efficiencyStd", 0.03),
                values.getOrDefault("cost", 100.0),
                values.getOrDefault("costStd", 10.0),
                values.getOrDefault("capacityKw", 1000.0),
                values.getOrDefault("capacityFactor", 0.25),
                values.getOrDefault("lifetime", 25.0),
                values.getOrDefault("theoreticalMaxEfficiency", 0.85),
                values.getOrDefault("targetLcoe", 0.05)
        );
    }

    /**
     * Parameters of a request; a sweep contributes its baseline.
     */
    public static HypothesisParameters of(ValidationRequest request) {
        if (request instanceof PhysicsValidation physics) {
            return from(physics.values());
        }
        if (request instanceof BatchValidation batch) {
            return from(batch.values());
        }
        if (request instanceof MonteCarlo monteCarlo) {
            return from(monteCarlo.values());
        }
        if (request instanceof ParametricSweep sweep) {
            return from(sweep.baseline());
        }
        throw new IllegalArgumentException("Unsupported request type: " + request.getClass().getName());
    }

    /**
     * Same parameters with one value replaced, by hypothesis name.
     */
    public HypothesisParameters with(String name, double value) {
        Map<String, Double> values = toValues();
        values.put(name, value);
        return from(values);
    }

    public Map<String, Double> toValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("efficiency", efficiency);
        values.put("efficiencyStd", efficiencyStd);
        values.put("cost", cost);
        values.put("costStd", costStd);
        values.put("capacityKw", capacityKw);
        values.put("capacityFactor", capacityFactor);
        values.put("lifetime", lifetimeYears);
        values.put("theoreticalMaxEfficiency", theoreticalMaxEfficiency);
        values.put("targetLcoe", targetLcoe);
        return values;
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        toValues().forEach((name, value) -> wire.put(wireName(name), value));
        return wire;
    }

    /**
     * Name the remote functions use for a hypothesis parameter. Unknown names pass through.
     */
    public static String wireName(String name) {
        return WIRE_NAMES.getOrDefault(name, name);
    }
}

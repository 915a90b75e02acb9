package com.gpupool.backend;

import com.gpupool.core.MetricEstimate;

import java.util.Map;
import java.util.Optional;

/**
 * Raw response of the backend for one validation, before the pool attaches
 * task identity, tier, timing and cost.
 */
public record ValidationOutcome(
        boolean physicallyValid,
        boolean economicallyViable,
        double confidenceScore,
        Map<String, MetricEstimate> metrics
) {
    public ValidationOutcome {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    /**
     * Describe what is wrong with this outcome, or empty if it can become a result.
     */
    public Optional<String> defect() {
        if (!Double.isFinite(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 1.0) {
            return Optional.of("confidence score out of range: " + confidenceScore);
        }
        for (Map.Entry<String, MetricEstimate> entry : metrics.entrySet()) {
            if (entry.getValue() == null || !entry.getValue().isFinite()) {
                return Optional.of("metric '" + entry.getKey() + "' is not a finite estimate");
            }
        }
        return Optional.empty();
    }
}

package com.gpupool.core;

import java.util.Map;

/**
 * Outcome of one validation task. Immutable.
 *
 * @param taskId             Task this result belongs to
 * @param hypothesisId       Hypothesis reference id
 * @param tier               Tier that produced the result
 * @param physicallyValid    Physics checks passed
 * @param economicallyViable Economics checks passed
 * @param confidenceScore    Quality score in [0, 1]
 * @param metrics            Named metrics (e.g. efficiency, lcoe)
 * @param durationMs         Wall-clock execution time
 * @param cost               Cost estimate for the run
 * @param fromCache          Whether the result was replayed from the cache
 */
public record ValidationResult(
        String taskId,
        String hypothesisId,
        Tier tier,
        boolean physicallyValid,
        boolean economicallyViable,
        double confidenceScore,
        Map<String, MetricEstimate> metrics,
        long durationMs,
        double cost,
        boolean fromCache
) {
    public ValidationResult {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    /**
     * Replay this result for another task, flagged as served from cache.
     */
    public ValidationResult replayFor(String replayTaskId, String replayHypothesisId) {
        return new ValidationResult(replayTaskId, replayHypothesisId, tier, physicallyValid,
                economicallyViable, confidenceScore, metrics, durationMs, cost, true);
    }
}

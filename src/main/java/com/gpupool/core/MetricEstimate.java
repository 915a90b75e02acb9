package com.gpupool.core;

/**
 * Mean of a named metric with its 95% interval.
 */
public record MetricEstimate(double mean, double ci95Low, double ci95High) {

    public boolean isFinite() {
        return Double.isFinite(mean) && Double.isFinite(ci95Low) && Double.isFinite(ci95High);
    }
}

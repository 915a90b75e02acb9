package com.gpupool.config;

/**
 * Configuration for the admission loop.
 *
 * @param tickIntervalMs              Interval between admission passes
 * @param queueTimeoutMs              Max time a task may wait in its tier queue
 * @param executionMarginMs           Extra time a blocked caller waits on top of the queue timeout
 * @param utilizationSampleIntervalMs How often utilization is recorded in the history (0 disables)
 * @param utilizationHistorySize      Number of utilization samples kept
 * @param healthCheckIntervalMs       How often tier handles are probed (0 disables)
 * @param dedupeInFlight              Join identical submissions onto the task already in flight
 */
public record SchedulerConfig(
        long tickIntervalMs,
        long queueTimeoutMs,
        long executionMarginMs,
        long utilizationSampleIntervalMs,
        int utilizationHistorySize,
        long healthCheckIntervalMs,
        boolean dedupeInFlight
) {
    public static SchedulerConfig defaults() {
        return new SchedulerConfig(
                50,          // tickIntervalMs
                30_000,      // queueTimeoutMs
                60_000,      // executionMarginMs
                5_000,       // utilizationSampleIntervalMs
                60,          // utilizationHistorySize
                0,           // healthCheckIntervalMs
                false        // dedupeInFlight
        );
    }

    /**
     * Wait budget of a caller blocked on a single task.
     */
    public long callerTimeoutMs() {
        return queueTimeoutMs + executionMarginMs;
    }

    public SchedulerConfig withQueueTimeoutMs(long value) {
        return new SchedulerConfig(tickIntervalMs, value, executionMarginMs,
                utilizationSampleIntervalMs, utilizationHistorySize, healthCheckIntervalMs, dedupeInFlight);
    }

    public SchedulerConfig withExecutionMarginMs(long value) {
        return new SchedulerConfig(tickIntervalMs, queueTimeoutMs, value,
                utilizationSampleIntervalMs, utilizationHistorySize, healthCheckIntervalMs, dedupeInFlight);
    }

    public SchedulerConfig withHealthCheckIntervalMs(long value) {
        return new SchedulerConfig(tickIntervalMs, queueTimeoutMs, executionMarginMs,
                utilizationSampleIntervalMs, utilizationHistorySize, value, dedupeInFlight);
    }

    public SchedulerConfig withDedupeInFlight(boolean value) {
        return new SchedulerConfig(tickIntervalMs, queueTimeoutMs, executionMarginMs,
                utilizationSampleIntervalMs, utilizationHistorySize, healthCheckIntervalMs, value);
    }

    public SchedulerConfig withUtilizationSampling(long intervalMs, int historySize) {
        return new SchedulerConfig(tickIntervalMs, queueTimeoutMs, executionMarginMs,
                intervalMs, historySize, healthCheckIntervalMs, dedupeInFlight);
    }
}

package com.gpupool.config;

/**
 * Remote execution backend configuration.
 *
 * @param type                Backend implementation
 * @param endpoint            Base endpoint of the GPU broker (HTTP only)
 * @param apiKey              Bearer token (HTTP only)
 * @param timeoutMs           Per-request timeout (HTTP only)
 * @param maxRetries          Retries after the first attempt (HTTP only)
 * @param retryBackoffMs      Base delay, doubled per attempt (HTTP only)
 * @param simulatedLatencyMs  Artificial latency per call (SIMULATED only)
 * @param simulatedIterations Monte Carlo samples per hypothesis (SIMULATED only)
 */
public record BackendConfig(
        BackendType type,
        String endpoint,
        String apiKey,
        long timeoutMs,
        int maxRetries,
        long retryBackoffMs,
        long simulatedLatencyMs,
        int simulatedIterations
) {
    public static BackendConfig simulated() {
        return new BackendConfig(BackendType.SIMULATED, null, null, 60_000, 2, 1_000, 0, 2_000);
    }

    public static BackendConfig http(String endpoint, String apiKey) {
        return new BackendConfig(BackendType.HTTP, endpoint, apiKey, 60_000, 2, 1_000, 0, 2_000);
    }
}

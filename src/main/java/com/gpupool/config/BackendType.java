package com.gpupool.config;

/**
 * Remote execution backends the pool can be wired to.
 */
public enum BackendType {
    /**
     * JSON over HTTP to a GPU broker.
     */
    HTTP,

    /**
     * In-process Monte Carlo, for local runs and demos.
     */
    SIMULATED
}

package com.gpupool.backend;

import com.gpupool.config.BackendConfig;
import com.gpupool.config.BackendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating RemoteExecutionHandle instances.
 */
public class BackendFactory {

    private static final Logger log = LoggerFactory.getLogger(BackendFactory.class);

    /**
     * Create a handle based on configuration. Defaults to the simulated backend.
     */
    public static RemoteExecutionHandle create(BackendConfig config) {
        BackendType type = config.type() != null ? config.type() : BackendType.SIMULATED;

        log.info("Creating remote execution backend: {}", type);

        return switch (type) {
            case HTTP -> new HttpValidationBackend(config);
            case SIMULATED -> new SimulatedValidationBackend(config);
        };
    }
}

package com.gpupool.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the GPU validation pool.
 */
@ConfigurationProperties(prefix = "gpu-pool")
public class PoolProperties {

    /**
     * Whether the pool is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the pool configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:gpu-pool.yaml";

    /**
     * Whether every pool event is written to the log.
     */
    private boolean logEvents = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public boolean isLogEvents() {
        return logEvents;
    }

    public void setLogEvents(boolean logEvents) {
        this.logEvents = logEvents;
    }
}

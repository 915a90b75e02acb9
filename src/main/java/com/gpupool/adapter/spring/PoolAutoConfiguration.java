package com.gpupool.adapter.spring;

import com.gpupool.backend.BackendFactory;
import com.gpupool.backend.RemoteExecutionHandle;
import com.gpupool.backend.TierRegistry;
import com.gpupool.config.ConfigLoader;
import com.gpupool.config.PoolConfig;
import com.gpupool.core.DefaultValidationPool;
import com.gpupool.core.ValidationPool;
import com.gpupool.event.LoggingEventListener;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the GPU validation pool.
 */
@Configuration
@ConditionalOnProperty(prefix = "gpu-pool", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PoolProperties.class)
public class PoolAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PoolAutoConfiguration.class);

    private ValidationPool validationPool;

    @Bean
    @ConditionalOnMissingBean
    public PoolConfig poolConfig(PoolProperties properties) {
        log.info("Loading GPU pool configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public TierRegistry tierRegistry(PoolConfig config) {
        RemoteExecutionHandle handle = BackendFactory.create(config.backend());
        return TierRegistry.fromConfig(config, tierConfig -> handle);
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationPool validationPool(PoolConfig config, TierRegistry registry, PoolProperties properties) {
        log.info("Creating ValidationPool: {}", config.name());
        DefaultValidationPool pool = new DefaultValidationPool(config, registry);
        if (properties.isLogEvents()) {
            pool.events().subscribe(new LoggingEventListener());
        }
        pool.start();
        this.validationPool = pool;
        return pool;
    }

    @PreDestroy
    public void shutdown() {
        if (validationPool != null && validationPool.isRunning()) {
            log.info("Shutting down ValidationPool");
            validationPool.stop();
        }
    }
}

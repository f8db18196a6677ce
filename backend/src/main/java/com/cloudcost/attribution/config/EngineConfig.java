package com.cloudcost.attribution.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ForkJoinPool;

/**
 * Infrastructure beans for the attribution engine.
 */
@Configuration
@Slf4j
public class EngineConfig {

    /**
     * Dedicated pool for per-record work so parallel streams do not compete with
     * the common pool.
     */
    @Bean(destroyMethod = "shutdown")
    public ForkJoinPool attributionWorkerPool(AttributionProperties properties) {
        int parallelism = properties.getParallelism() > 0
                ? properties.getParallelism()
                : Runtime.getRuntime().availableProcessors();
        log.info("Attribution worker pool initialized with parallelism {}", parallelism);
        return new ForkJoinPool(parallelism);
    }
}

package com.Excel.Variance.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AnalysisConfig {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisConfig.class);

    /**
     * Worker pool for structure probes, per-statement matching and drill-down graph building.
     */
    @Bean(name = "analysisExecutor", destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor(VarianceProperties properties) {
        int threads = properties.effectiveWorkerThreads();
        logger.info("Starting analysis worker pool with {} threads", threads);
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("variance-worker-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}

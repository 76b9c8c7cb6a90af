package com.myorg.normcontrol.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for page-level stages.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(name = "complianceExecutor")
    public ThreadPoolTaskExecutor complianceExecutor(ComplianceProperties properties) {
        int threads = properties.workerThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("compliance-");

        // never reject: a saturated pool degrades to running on the caller
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);

        executor.initialize();
        log.info("Compliance executor started with {} threads", threads);
        return executor;
    }
}

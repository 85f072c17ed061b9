package com.company.failover.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pools for probing. Region probes run {@code concurrency} at a time and
 * each region fans out its sub-checks on the endpoint pool.
 */
@Configuration
@Slf4j
public class ProbeExecutorConfig {

    @Value("${failover.health.concurrency:5}")
    private int concurrency;

    @Value("${failover.async.pool-size:4}")
    private int asyncPoolSize;

    @Bean(name = "regionProbeExecutor")
    public ThreadPoolTaskExecutor regionProbeExecutor() {
        return executor("region-probe-", concurrency, concurrency);
    }

    @Bean(name = "endpointCheckExecutor")
    public ThreadPoolTaskExecutor endpointCheckExecutor() {
        return executor("endpoint-check-", concurrency * 4, concurrency * 4);
    }

    /**
     * Used by @Async event listeners
     */
    @Bean(name = "taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = executor("failover-async-", asyncPoolSize, asyncPoolSize);
        executor.setQueueCapacity(500);
        return executor;
    }

    private ThreadPoolTaskExecutor executor(String prefix, int core, int max) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Executor {} configured with {} threads", prefix, max);
        return executor;
    }
}

package com.marketscan.config;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for per-symbol scans and the exchange clock.
 *
 * <p>The pool is fixed size (core = max) with a queue large enough for a full tick of every
 * configured symbol. When the queue is full the submitting scan-loop thread runs the task
 * itself rather than dropping a symbol.
 */
@Configuration
public class EngineExecutorConfig {

    @Value("${marketscan.engine.worker-pool-size:10}")
    private int workerPoolSize;

    @Value("${marketscan.engine.worker-queue-capacity:100}")
    private int queueCapacity;

    @Bean("scanWorkerExecutor")
    public ThreadPoolTaskExecutor scanWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerPoolSize);
        executor.setMaxPoolSize(workerPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("scan-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public Clock exchangeClock(@Value("${trading-calendar.timezone:Asia/Kolkata}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }
}

package com.dbbaskette.codeguardian.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pools for the two places work leaves the request thread: the timeout-bounded
 * analysis call and the bulk fix workers.
 */
@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(CodeGuardianProperties properties) {
        int size = properties.getAnalysis().getMaxConcurrentAnalyses();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(size * 4);
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getAnalysis().getTimeoutSeconds());
        executor.initialize();
        log.info("Analysis executor configured: threads={}, queue={}", size, size * 4);
        return executor;
    }

    @Bean(name = "bulkFixExecutor")
    public ThreadPoolTaskExecutor bulkFixExecutor(CodeGuardianProperties properties) {
        int workers = properties.getFixes().getBulkWorkers();
        // Room for a few full batches queued behind the workers
        int queue = properties.getFixes().getMaxBatchSize() * 8;
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix("bulk-fix-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Bulk fix executor configured: workers={}, queue={}", workers, queue);
        return executor;
    }
}

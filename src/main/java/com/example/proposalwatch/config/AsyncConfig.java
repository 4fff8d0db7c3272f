package com.example.proposalwatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the watcher.
 * <p>
 * - taskScheduler: drives the @Scheduled tick loop, never runs fetch work
 * - fetchExecutor: worker context for fetch runs, which may block for minutes
 * - retryTaskScheduler: one-shot delayed retries
 * - taskExecutor: Spring's @Async methods (alerts)
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("job-tick-");
        return scheduler;
    }

    /**
     * Fetch workers. In-flight runs are allowed to finish on shutdown so the
     * execution guard is released naturally.
     */
    @Bean(name = "fetchExecutor")
    public ThreadPoolTaskExecutor fetchExecutor(ProposalWatchProperties properties) {
        log.info("Creating fetch executor with {} worker threads", properties.getFetchPoolSize());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFetchPoolSize());
        executor.setMaxPoolSize(properties.getFetchPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("fetch-worker-");
        // Rejections surface as TaskRejectedException to FetchDispatcher
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getRefresh().getTimeoutSeconds() + 30);
        return executor;
    }

    @Bean(name = "retryTaskScheduler")
    public ThreadPoolTaskScheduler retryTaskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("fetch-retry-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean(name = "taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}

package com.marketplace.config;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor behind every {@code @Async("eventExecutor")} listener: STOMP pushes to the
 * frontend and server-side notification writes. Subscription callbacks publish events and
 * return; the I/O happens here, off the realtime scheduler threads.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${marketplace.async.core-pool-size:2}")
    private int pushThreads;

    @Value("${marketplace.async.max-pool-size:8}")
    private int maxPushThreads;

    @Value("${marketplace.async.queue-capacity:500}")
    private int pendingPushes;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("realtime-push-");
        executor.setCorePoolSize(pushThreads);
        executor.setMaxPoolSize(Math.max(pushThreads, maxPushThreads));
        executor.setQueueCapacity(pendingPushes);
        executor.setRejectedExecutionHandler(runOnPublisherWhenSaturated());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (throwable, method, params) -> LoggerFactory.getLogger(method.getDeclaringClass())
                .error("Realtime listener {} failed: {}", method.getName(), throwable.getMessage(), throwable);
    }

    /** A full queue slows the publishing thread down instead of losing a notification. */
    private RejectedExecutionHandler runOnPublisherWhenSaturated() {
        ThreadPoolExecutor.CallerRunsPolicy callerRuns = new ThreadPoolExecutor.CallerRunsPolicy();
        return (task, pool) -> {
            log.warn("eventExecutor saturated ({} queued), running push on {}",
                    pool.getQueue().size(), Thread.currentThread().getName());
            callerRuns.rejectedExecution(task, pool);
        };
    }
}

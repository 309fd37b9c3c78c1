package com.marketplace.config;

import com.marketplace.realtime.ReconnectionPolicy;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and bean definitions for realtime subscriptions.
 *
 * <p>Binds to the {@code marketplace.realtime.*} prefix in application.properties. Provides:
 * <ul>
 *   <li>The {@link ReconnectionPolicy} shared by every session's manager.</li>
 *   <li>The {@code realtimeTaskScheduler} that runs reconnect delays and connect timeouts.</li>
 *   <li>A {@link RestClient} for the marketplace API (product lookups, server-side
 *       notification writes).</li>
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "marketplace.realtime")
@Getter
@Setter
public class RealtimeConfig {

    private static final Logger log = LoggerFactory.getLogger(RealtimeConfig.class);

    /** Window in which a handle must report connected before it is treated as failed. */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Maximum notifications kept per session; the oldest are evicted first. */
    private int storeCapacity = 50;

    /** Whether sessions also subscribe to product analytics for the seller dashboard. */
    private boolean analyticsEnabled = true;

    private Reconnect reconnect = new Reconnect();

    private Scheduler scheduler = new Scheduler();

    private Api api = new Api();

    private Catalog catalog = new Catalog();

    private Persistence persistence = new Persistence();

    @Bean
    public ReconnectionPolicy reconnectionPolicy() {
        log.info(
                "Reconnection policy: maxRetries={}, baseDelay={}, maxDelay={}, minRetryInterval={}",
                reconnect.getMaxRetries(),
                reconnect.getBaseDelay(),
                reconnect.getMaxDelay(),
                reconnect.getMinRetryInterval());
        return new ReconnectionPolicy(
                reconnect.getMaxRetries(),
                reconnect.getBaseDelay(),
                reconnect.getMaxDelay(),
                reconnect.getMinRetryInterval());
    }

    @Bean("realtimeTaskScheduler")
    public ThreadPoolTaskScheduler realtimeTaskScheduler() {
        ThreadPoolTaskScheduler taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(scheduler.getPoolSize());
        taskScheduler.setThreadNamePrefix("realtime-");
        taskScheduler.setRemoveOnCancelPolicy(true);
        taskScheduler.setWaitForTasksToCompleteOnShutdown(false);
        return taskScheduler;
    }

    /**
     * RestClient for the marketplace API.
     * Used by the product catalog and the server-side notification writer.
     */
    @Bean
    public RestClient marketplaceApiRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(api.getConnectTimeout());
        requestFactory.setReadTimeout(api.getReadTimeout());
        return RestClient.builder()
                .baseUrl(api.getUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Getter
    @Setter
    public static class Reconnect {

        /** Retries after which the session goes OFFLINE until a manual reconnect. */
        private int maxRetries = ReconnectionPolicy.DEFAULT_MAX_RETRIES;

        private Duration baseDelay = ReconnectionPolicy.DEFAULT_BASE_DELAY;

        private Duration maxDelay = ReconnectionPolicy.DEFAULT_MAX_DELAY;

        /** Minimum spacing between two reconnect attempts, whatever the number of failures. */
        private Duration minRetryInterval = ReconnectionPolicy.DEFAULT_MIN_RETRY_INTERVAL;
    }

    @Getter
    @Setter
    public static class Scheduler {

        private int poolSize = 2;
    }

    @Getter
    @Setter
    public static class Api {

        /** Base URL of the marketplace API. */
        private String url = "http://localhost:3000";

        /** HTTP connect timeout in milliseconds. */
        private int connectTimeout = 5000;

        /** HTTP read timeout in milliseconds. */
        private int readTimeout = 10000;
    }

    @Getter
    @Setter
    public static class Catalog {

        private Duration cacheTtl = Duration.ofMinutes(5);

        private long cacheMaxSize = 1000;
    }

    @Getter
    @Setter
    public static class Persistence {

        /** Whether inserted notifications are also written to the marketplace API. */
        private boolean enabled = false;
    }
}

package com.marketplace.observability;

import com.marketplace.event.ConnectivityEvent;
import com.marketplace.event.NotificationEvent;
import com.marketplace.realtime.ConnectivityState;
import com.marketplace.session.RealtimeSessionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the realtime Micrometer meters.
 * <ul>
 *   <li><b>realtime.notifications.delivered</b> (counter): notifications inserted into a store</li>
 *   <li><b>realtime.notifications.duplicates</b> (counter): re-deliveries suppressed by id</li>
 *   <li><b>realtime.translation.failures</b> (counter): malformed change events dropped</li>
 *   <li><b>realtime.persistence.failures</b> (counter): failed server-side writes</li>
 *   <li><b>realtime.connectivity.offline</b> (counter): sessions that exhausted their retries</li>
 *   <li><b>realtime.sessions.active</b> (gauge): open sessions</li>
 * </ul>
 */
@Service
public class RealtimeMetricsService {

    private static final Logger log = LoggerFactory.getLogger(RealtimeMetricsService.class);

    private final Counter deliveredCounter;
    private final Counter duplicateCounter;
    private final Counter translationFailureCounter;
    private final Counter persistenceFailureCounter;
    private final Counter offlineCounter;

    public RealtimeMetricsService(MeterRegistry meterRegistry, RealtimeSessionRegistry realtimeSessionRegistry) {
        this.deliveredCounter = Counter.builder("realtime.notifications.delivered")
                .description("Notifications inserted into a session store")
                .register(meterRegistry);

        this.duplicateCounter = Counter.builder("realtime.notifications.duplicates")
                .description("Re-delivered change events suppressed by notification id")
                .register(meterRegistry);

        this.translationFailureCounter = Counter.builder("realtime.translation.failures")
                .description("Malformed change events dropped by the translator")
                .register(meterRegistry);

        this.persistenceFailureCounter = Counter.builder("realtime.persistence.failures")
                .description("Failed best-effort server-side notification writes")
                .register(meterRegistry);

        this.offlineCounter = Counter.builder("realtime.connectivity.offline")
                .description("Sessions that exhausted their reconnect attempts")
                .register(meterRegistry);

        meterRegistry.gauge("realtime.sessions.active", realtimeSessionRegistry, RealtimeSessionRegistry::activeCount);
    }

    @EventListener
    @Order(20)
    public void onNotificationEvent(NotificationEvent event) {
        switch (event.getEventType()) {
            case DELIVERED -> deliveredCounter.increment();
            case DUPLICATE -> duplicateCounter.increment();
            case TRANSLATION_FAILED -> translationFailureCounter.increment();
            case PERSISTENCE_FAILED -> persistenceFailureCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onConnectivityEvent(ConnectivityEvent event) {
        if (event.getNewState() == ConnectivityState.OFFLINE) {
            offlineCounter.increment();
            log.warn("Realtime session for user {} is offline after {} retries", event.getUserId(),
                    event.getRetryCount());
        }
    }
}

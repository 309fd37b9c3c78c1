package com.marketplace.session;

import com.marketplace.analytics.AnalyticsRefreshTrigger;
import com.marketplace.config.RealtimeConfig;
import com.marketplace.event.EventPublisherHelper;
import com.marketplace.exception.ResourceNotFoundException;
import com.marketplace.notification.NotificationPipeline;
import com.marketplace.notification.NotificationStore;
import com.marketplace.realtime.ChangeEventSource;
import com.marketplace.realtime.MarketplaceStreams;
import com.marketplace.realtime.ReconnectionPolicy;
import com.marketplace.realtime.StreamBinding;
import com.marketplace.realtime.StreamDeclaration;
import com.marketplace.realtime.SubscriptionManager;
import com.marketplace.translation.EventTranslator;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Owns the realtime sessions of all signed-in users, one per user id.
 *
 * <p>Opening a session wires its streams: the order and message streams feed a per-session
 * {@link NotificationPipeline}; the analytics stream (when enabled) feeds the shared
 * {@link AnalyticsRefreshTrigger}. Opening an existing session only re-runs its idempotent
 * start. All sessions are stopped on shutdown.
 */
@Service
public class RealtimeSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(RealtimeSessionRegistry.class);

    private final ChangeEventSource changeEventSource;
    private final ReconnectionPolicy reconnectionPolicy;
    private final TaskScheduler taskScheduler;
    private final EventTranslator eventTranslator;
    private final AnalyticsRefreshTrigger analyticsRefreshTrigger;
    private final EventPublisherHelper eventPublisherHelper;
    private final RealtimeConfig realtimeConfig;

    private final Map<String, RealtimeSession> sessions = new ConcurrentHashMap<>();

    public RealtimeSessionRegistry(
            ChangeEventSource changeEventSource,
            ReconnectionPolicy reconnectionPolicy,
            @Qualifier("realtimeTaskScheduler") TaskScheduler taskScheduler,
            EventTranslator eventTranslator,
            AnalyticsRefreshTrigger analyticsRefreshTrigger,
            EventPublisherHelper eventPublisherHelper,
            RealtimeConfig realtimeConfig) {
        this.changeEventSource = changeEventSource;
        this.reconnectionPolicy = reconnectionPolicy;
        this.taskScheduler = taskScheduler;
        this.eventTranslator = eventTranslator;
        this.analyticsRefreshTrigger = analyticsRefreshTrigger;
        this.eventPublisherHelper = eventPublisherHelper;
        this.realtimeConfig = realtimeConfig;
    }

    /**
     * Returns the user's session, creating and starting it if needed.
     */
    public RealtimeSession open(String userId) {
        RealtimeSession session = sessions.computeIfAbsent(userId, this::createSession);
        session.start();
        return session;
    }

    /**
     * Stops and forgets the user's session.
     *
     * @return false if the user had no session
     */
    public boolean close(String userId) {
        RealtimeSession session = sessions.remove(userId);
        if (session == null) {
            return false;
        }
        session.close();
        log.info("Realtime session closed for user {}", userId);
        return true;
    }

    /**
     * Manual recovery for a session that went offline.
     *
     * @throws ResourceNotFoundException if the user has no session
     */
    public RealtimeSession reconnect(String userId) {
        RealtimeSession session = require(userId);
        session.reconnect();
        return session;
    }

    public Optional<RealtimeSession> find(String userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    public RealtimeSession require(String userId) {
        RealtimeSession session = sessions.get(userId);
        if (session == null) {
            throw ResourceNotFoundException.session(userId);
        }
        return session;
    }

    public Collection<RealtimeSession> sessions() {
        return List.copyOf(sessions.values());
    }

    public int activeCount() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        if (sessions.isEmpty()) {
            return;
        }
        log.info("Stopping {} realtime sessions", sessions.size());
        for (String userId : List.copyOf(sessions.keySet())) {
            try {
                close(userId);
            } catch (RuntimeException e) {
                log.error("Failed to close realtime session for {}: {}", userId, e.getMessage(), e);
            }
        }
    }

    private RealtimeSession createSession(String userId) {
        NotificationStore store = new NotificationStore(
                realtimeConfig.getStoreCapacity(),
                (kind, title, body) -> eventPublisherHelper.publishToast(this, userId, kind, title, body));
        NotificationPipeline pipeline =
                new NotificationPipeline(userId, eventTranslator, store, eventPublisherHelper);

        List<StreamBinding> bindings = new ArrayList<>();
        for (StreamDeclaration declaration : MarketplaceStreams.notificationStreams()) {
            bindings.add(new StreamBinding(declaration, pipeline));
        }
        if (realtimeConfig.isAnalyticsEnabled()) {
            bindings.add(new StreamBinding(MarketplaceStreams.ANALYTICS_AS_SELLER, analyticsRefreshTrigger));
        }

        SubscriptionManager manager = new SubscriptionManager(
                changeEventSource,
                () -> userId,
                reconnectionPolicy,
                taskScheduler,
                bindings,
                realtimeConfig.getConnectTimeout());

        log.info("Realtime session created for user {} ({} streams)", userId, bindings.size());
        return new RealtimeSession(userId, manager, store, eventPublisherHelper);
    }
}

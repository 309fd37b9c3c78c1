package com.marketplace.api.websocket;

import com.marketplace.session.RealtimeSessionRegistry;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Closes a user's realtime session when their last STOMP connection goes away.
 *
 * <p>The CONNECT frame carries the {@code X-User-Id} native header; connections without it
 * are not tracked. Spring fires {@link SessionDisconnectEvent} for graceful and abrupt
 * disconnects alike (tab close, network drop), possibly more than once per session, so the
 * handling is idempotent.
 */
@Component
public class StompSessionDisconnectListener {

    private static final Logger log = LoggerFactory.getLogger(StompSessionDisconnectListener.class);

    static final String USER_HEADER = "X-User-Id";

    private final RealtimeSessionRegistry realtimeSessionRegistry;

    /** STOMP session id to user id. */
    private final Map<String, String> stompSessions = new ConcurrentHashMap<>();

    /** Open STOMP connections per user; a user's entry is only changed through {@code compute}. */
    private final ConcurrentHashMap<String, Integer> connectionsPerUser = new ConcurrentHashMap<>();

    public StompSessionDisconnectListener(RealtimeSessionRegistry realtimeSessionRegistry) {
        this.realtimeSessionRegistry = realtimeSessionRegistry;
    }

    @EventListener
    public void onSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String userId = accessor.getFirstNativeHeader(USER_HEADER);
        String sessionId = accessor.getSessionId();
        if (userId == null || userId.isBlank() || sessionId == null) {
            return;
        }
        if (stompSessions.putIfAbsent(sessionId, userId) != null) {
            return;
        }
        connectionsPerUser.compute(userId, (user, count) -> count == null ? 1 : count + 1);
        log.debug("STOMP session {} connected for user {}", sessionId, userId);
    }

    @EventListener
    public void onSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        String userId = stompSessions.remove(sessionId);
        if (userId == null) {
            return;
        }
        log.debug("STOMP session {} disconnected for user {}", sessionId, userId);

        // Closing inside compute holds back a concurrent CONNECT of the same user until the
        // old session is gone
        connectionsPerUser.compute(userId, (user, count) -> {
            if (count == null || count <= 1) {
                realtimeSessionRegistry.close(user);
                return null;
            }
            return count - 1;
        });
    }
}

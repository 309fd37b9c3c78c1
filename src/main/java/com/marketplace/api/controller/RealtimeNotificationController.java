package com.marketplace.api.controller;

import com.marketplace.api.dto.response.ConnectivityResponse;
import com.marketplace.api.dto.response.NotificationListResponse;
import com.marketplace.api.dto.response.NotificationResponse;
import com.marketplace.exception.UnauthorizedException;
import com.marketplace.notification.Notification;
import com.marketplace.notification.NotificationStore;
import com.marketplace.session.RealtimeSession;
import com.marketplace.session.RealtimeSessionRegistry;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the caller's realtime session and notification history.
 *
 * <p>The caller is identified by the {@code X-User-Id} header set by the authenticating
 * gateway; requests without it are rejected with 401.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/realtime/session} -- open (or resume) the session</li>
 *   <li>{@code DELETE /api/realtime/session} -- close the session</li>
 *   <li>{@code POST /api/realtime/session/reconnect} -- manual reconnect after going offline</li>
 *   <li>{@code GET /api/realtime/session} -- connectivity and handle status</li>
 *   <li>{@code GET /api/realtime/notifications} -- newest-first history, optionally unread only</li>
 *   <li>{@code POST /api/realtime/notifications/{id}/read} -- mark one read</li>
 *   <li>{@code POST /api/realtime/notifications/read-all} -- mark all read</li>
 *   <li>{@code DELETE /api/realtime/notifications} -- clear the history</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/realtime")
public class RealtimeNotificationController {

    static final String USER_HEADER = "X-User-Id";

    private final RealtimeSessionRegistry realtimeSessionRegistry;

    public RealtimeNotificationController(RealtimeSessionRegistry realtimeSessionRegistry) {
        this.realtimeSessionRegistry = realtimeSessionRegistry;
    }

    @PostMapping("/session")
    public ConnectivityResponse openSession(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        return ConnectivityResponse.from(realtimeSessionRegistry.open(requireUser(userId)));
    }

    @DeleteMapping("/session")
    public Map<String, Object> closeSession(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        boolean closed = realtimeSessionRegistry.close(requireUser(userId));
        return Map.of("closed", closed);
    }

    @PostMapping("/session/reconnect")
    public ConnectivityResponse reconnect(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        return ConnectivityResponse.from(realtimeSessionRegistry.reconnect(requireUser(userId)));
    }

    @GetMapping("/session")
    public ConnectivityResponse getStatus(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        return ConnectivityResponse.from(realtimeSessionRegistry.require(requireUser(userId)));
    }

    @GetMapping("/notifications")
    public NotificationListResponse listNotifications(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestParam(defaultValue = "false") boolean unreadOnly) {
        NotificationStore store = storeOf(userId);
        List<Notification> notifications = unreadOnly ? store.listUnread() : store.list();
        return new NotificationListResponse(
                notifications.stream().map(NotificationResponse::from).toList(), store.unreadCount(), store.size());
    }

    @PostMapping("/notifications/{notificationId}/read")
    public Map<String, Object> markRead(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @PathVariable String notificationId) {
        NotificationStore store = storeOf(userId);
        boolean updated = store.markRead(notificationId);
        return Map.of("updated", updated, "unreadCount", store.unreadCount());
    }

    @PostMapping("/notifications/read-all")
    public Map<String, Object> markAllRead(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        int updated = storeOf(userId).markAllRead();
        return Map.of("updated", updated, "unreadCount", 0);
    }

    @DeleteMapping("/notifications")
    public Map<String, Object> clear(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        storeOf(userId).clear();
        return Map.of("cleared", true);
    }

    private NotificationStore storeOf(String userId) {
        RealtimeSession session = realtimeSessionRegistry.require(requireUser(userId));
        return session.getNotificationStore();
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw UnauthorizedException.missingHeader(USER_HEADER);
        }
        return userId;
    }
}

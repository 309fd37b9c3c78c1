package com.marketplace.api.dto.response;

import com.marketplace.realtime.ConnectivityState;
import com.marketplace.realtime.HandleSnapshot;
import com.marketplace.realtime.SubscriptionManager;
import com.marketplace.session.RealtimeSession;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Connectivity of a realtime session, as shown by the status indicator and the debug views.
 */
@Getter
@Builder
public class ConnectivityResponse {

    private final String userId;
    private final ConnectivityState state;
    private final boolean connected;
    private final int retryCount;
    private final boolean retryPending;
    private final long epoch;
    private final List<HandleSnapshot> handles;
    private final int unreadCount;
    private final Instant openedAt;

    public static ConnectivityResponse from(RealtimeSession session) {
        SubscriptionManager manager = session.getSubscriptionManager();
        ConnectivityState state = manager.getConnectivity();
        return ConnectivityResponse.builder()
                .userId(session.getUserId())
                .state(state)
                .connected(state == ConnectivityState.CONNECTED)
                .retryCount(manager.getRetryCount())
                .retryPending(manager.isRetryPending())
                .epoch(manager.getEpoch())
                .handles(manager.getHandles())
                .unreadCount(session.getNotificationStore().unreadCount())
                .openedAt(session.getOpenedAt())
                .build();
    }
}

package com.marketplace.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP endpoint for the frontend's realtime channel.
 *
 * <p>Clients connect to {@code /ws} and subscribe under {@code /topic/realtime/{userId}/}
 * to {@code notifications}, {@code toasts}, {@code connectivity} and {@code analytics}.
 * Broker heartbeats let a dead browser tab surface as a disconnect, which closes the
 * user's realtime session (see {@link com.marketplace.api.websocket.StompSessionDisconnectListener}).
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${marketplace.cors.allowed-origin:*}")
    private String[] allowedOrigins;

    @Value("${marketplace.websocket.heartbeat-ms:10000}")
    private long heartbeatMs;

    private final TaskScheduler heartbeatScheduler;

    public WebSocketConfig(@Qualifier("realtimeTaskScheduler") TaskScheduler heartbeatScheduler) {
        this.heartbeatScheduler = heartbeatScheduler;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns(allowedOrigins);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic")
                .setHeartbeatValue(new long[] {heartbeatMs, heartbeatMs})
                .setTaskScheduler(heartbeatScheduler);
        registry.setApplicationDestinationPrefixes("/app");
    }
}

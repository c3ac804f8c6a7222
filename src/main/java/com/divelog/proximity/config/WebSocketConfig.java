package com.divelog.proximity.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket between the device and the engine.
 *
 * Endpoints:
 * - /ws/device: WebSocket connection endpoint
 * - /app/position, /app/position/failure: device readings and fix failures
 * - /topic/device/sampling: sampling directives for the device location service
 * - /topic/device/consent: consent prompt requests
 * - /topic/reminders: scheduled dive log reminders and prompts
 * - /topic/safe-mode: degraded-health escalations
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${divelog.websocket.endpoint:/ws/device}")
    private String websocketEndpoint;

    @Value("${divelog.websocket.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic", "/user");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        // Native WebSocket clients (the mobile app) connect without SockJS
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}

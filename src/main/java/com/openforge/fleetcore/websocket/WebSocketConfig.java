package com.openforge.fleetcore.websocket;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Spring STOMP/WebSocket configuration.
 *
 * Client flow:
 *   1. Connect to  ws://host/ws  (or SockJS fallback: http://host/ws)
 *   2. POST /api/research/runs and read the runId
 *   3. STOMP SUBSCRIBE /topic/research/{runId}
 *
 * The in-memory simple broker serves single-node deployments.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                // dev default; tighten per deployment
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }
}

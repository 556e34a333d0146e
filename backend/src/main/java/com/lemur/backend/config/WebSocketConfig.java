package com.lemur.backend.config;

import com.lemur.backend.websocket.AgentWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final AgentWebSocketHandler agentWebSocketHandler;

    @Value("${agent.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(AgentWebSocketHandler agentWebSocketHandler) {
        this.agentWebSocketHandler = agentWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // One socket per session; the handler starts the loop on connect
        registry.addHandler(agentWebSocketHandler, "/agent/{sessionId}/ws")
                .setAllowedOrigins(allowedOrigins);
    }
}

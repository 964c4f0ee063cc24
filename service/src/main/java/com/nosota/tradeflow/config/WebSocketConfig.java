package com.nosota.tradeflow.config;

import com.nosota.tradeflow.realtime.ActorHandshakeInterceptor;
import com.nosota.tradeflow.realtime.ConversationSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ConversationSocketHandler conversationSocketHandler;
    private final ActorHandshakeInterceptor actorHandshakeInterceptor;

    @Value("${realtime.endpoint:/ws}")
    private String endpoint;

    @Value("${realtime.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(conversationSocketHandler, endpoint)
                .addInterceptors(actorHandshakeInterceptor)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}

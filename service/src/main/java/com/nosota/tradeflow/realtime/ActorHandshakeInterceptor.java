package com.nosota.tradeflow.realtime;

import com.nosota.tradeflow.api.ActorHeaders;
import com.nosota.tradeflow.api.model.ActorRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Copies the caller's identity onto the socket session.
 *
 * <p>Reads the gateway's actor headers, falling back to {@code actorId}/{@code actorRole}
 * query parameters for browser clients that cannot set handshake headers. A handshake without
 * a usable identity is still accepted; the handler closes it with 4001 once open.
 */
@Component
@Slf4j
public class ActorHandshakeInterceptor implements HandshakeInterceptor {

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        Map<String, String> query = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().toSingleValueMap();

        String actorId = firstNonBlank(request.getHeaders().getFirst(ActorHeaders.ACTOR_ID),
                query.get(ConversationSubscriberRegistry.USER_ID_ATTRIBUTE));
        String actorRole = firstNonBlank(request.getHeaders().getFirst(ActorHeaders.ACTOR_ROLE),
                query.get(ConversationSubscriberRegistry.ROLE_ATTRIBUTE));

        try {
            if (actorId != null && actorRole != null) {
                ActorRole role = ActorRole.valueOf(actorRole.trim().toUpperCase());
                if (role != ActorRole.SYSTEM) {
                    attributes.put(ConversationSubscriberRegistry.USER_ID_ATTRIBUTE, Long.valueOf(actorId.trim()));
                    attributes.put(ConversationSubscriberRegistry.ROLE_ATTRIBUTE, role);
                }
            }
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed socket identity {}/{}: {}", actorId, actorRole, e.getMessage());
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to do
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}

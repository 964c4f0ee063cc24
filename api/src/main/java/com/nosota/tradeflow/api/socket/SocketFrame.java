package com.nosota.tradeflow.api.socket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nosota.tradeflow.api.response.MessageResponse;

import java.util.UUID;

/**
 * Frame exchanged over the real-time connection.
 *
 * <p>Client to server: {@code {type:"join", conversationId}}.
 * Server to client: {@code connected}, {@code joined}, {@code error} and
 * {@code {type:"new_message", conversationId, message}}.
 *
 * @param type           Frame type
 * @param conversationId Conversation the frame refers to
 * @param userId         Connected user, only on {@code connected}
 * @param reason         Error text, only on {@code error}
 * @param message        Message payload, only on {@code new_message}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SocketFrame(
        String type,
        UUID conversationId,
        Long userId,
        String reason,
        MessageResponse message
) {

    public static final String JOIN = "join";
    public static final String CONNECTED = "connected";
    public static final String JOINED = "joined";
    public static final String ERROR = "error";
    public static final String NEW_MESSAGE = "new_message";

    public static SocketFrame join(UUID conversationId) {
        return new SocketFrame(JOIN, conversationId, null, null, null);
    }

    public static SocketFrame connected(Long userId) {
        return new SocketFrame(CONNECTED, null, userId, null, null);
    }

    public static SocketFrame joined(UUID conversationId) {
        return new SocketFrame(JOINED, conversationId, null, null, null);
    }

    public static SocketFrame error(UUID conversationId, String reason) {
        return new SocketFrame(ERROR, conversationId, null, reason, null);
    }

    public static SocketFrame newMessage(UUID conversationId, MessageResponse message) {
        return new SocketFrame(NEW_MESSAGE, conversationId, null, null, message);
    }
}

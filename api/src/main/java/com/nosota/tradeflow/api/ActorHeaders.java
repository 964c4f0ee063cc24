package com.nosota.tradeflow.api;

/**
 * HTTP headers carrying the caller identity.
 *
 * <p>Authentication happens upstream; the gateway in front of the service resolves the
 * session and forwards the acting user id and the role the user is acting in. The same
 * headers are read during the WebSocket handshake.
 */
public final class ActorHeaders {

    public static final String ACTOR_ID = "X-Actor-Id";

    public static final String ACTOR_ROLE = "X-Actor-Role";

    public static final String CORRELATION_ID = "X-Correlation-Id";

    private ActorHeaders() {
    }
}

package com.nosota.tradeflow.api.response;

public record UnreadCountResponse(
        long unreadCount
) {
}

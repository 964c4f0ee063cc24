package com.nosota.tradeflow.realtime;

import com.nosota.tradeflow.api.response.MessageResponse;

import java.util.UUID;

/**
 * Published inside the appending transaction; broadcast once it commits.
 */
public record MessageAppendedEvent(UUID conversationId, MessageResponse message) {
}

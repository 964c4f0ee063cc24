package com.nosota.tradeflow.api.response;

import com.nosota.tradeflow.api.model.ActorRole;

import java.time.LocalDateTime;

public record ParticipantResponse(
        Long userId,
        ActorRole role,
        long lastReadSequence,
        LocalDateTime joinedAt
) {
}

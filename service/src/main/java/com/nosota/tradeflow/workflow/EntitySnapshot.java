package com.nosota.tradeflow.workflow;

import java.util.UUID;

/**
 * Read-only view of a workflow entity's status and parties.
 */
public record EntitySnapshot(String status, Long buyerId, Long sellerId, UUID conversationId) {
}

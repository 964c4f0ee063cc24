package com.nosota.tradeflow.api.model;

/**
 * Conversation status. Moves forward only: ACTIVE to RESOLVED to ARCHIVED, or ACTIVE
 * straight to ARCHIVED.
 */
public enum ConversationStatus {
    ACTIVE,
    RESOLVED,
    ARCHIVED
}

package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.EntityType;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outbound side of the payment gateway: the only call made is asking for a hosted session.
 * The gateway reports the result through the payment callback endpoint, echoing
 * {@code referenceId}.
 */
public interface PaymentGateway {

    /**
     * @return URL of the hosted payment page
     */
    String createSession(UUID referenceId, EntityType entityType, UUID entityId, BigDecimal amount);
}

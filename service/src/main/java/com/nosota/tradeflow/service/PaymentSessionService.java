package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.model.PaymentSession;
import com.nosota.tradeflow.model.PaymentSessionStatus;
import com.nosota.tradeflow.repository.PaymentSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSessionService {

    private final PaymentSessionRepository paymentSessionRepository;
    private final PaymentGateway paymentGateway;

    /**
     * Requests a hosted payment session for an entity and stores it as OPEN. Runs in the
     * caller's transaction.
     */
    public PaymentSession requestSession(EntityType entityType, UUID entityId, BigDecimal amount) {
        UUID referenceId = UUID.randomUUID();
        String url = paymentGateway.createSession(referenceId, entityType, entityId, amount);

        PaymentSession session = new PaymentSession();
        session.setId(referenceId);
        session.setEntityType(entityType);
        session.setEntityId(entityId);
        session.setAmount(amount);
        session.setStatus(PaymentSessionStatus.OPEN);
        session.setSessionUrl(url);
        session.setCreatedAt(LocalDateTime.now());

        PaymentSession saved = paymentSessionRepository.save(session);
        log.info("Payment session {} opened for {} {} ({})", referenceId, entityType, entityId, amount);
        return saved;
    }
}

package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.PaymentOutcome;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.PaymentResultRequest;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.api.response.PaymentResultResponse;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.model.PaymentSession;
import com.nosota.tradeflow.model.PaymentSessionStatus;
import com.nosota.tradeflow.repository.PaymentSessionRepository;
import com.nosota.tradeflow.workflow.EntitySnapshot;
import com.nosota.tradeflow.workflow.TransitionResult;
import com.nosota.tradeflow.workflow.WorkflowEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;

/**
 * Settles payment sessions reported by the payment gateway.
 *
 * <p>The session row is locked while the result is applied, so a callback delivered twice is
 * handled once: the second delivery finds the session settled and reports a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentCallbackService {

    private final PaymentSessionRepository paymentSessionRepository;
    private final WorkflowEngine workflowEngine;
    private final NotificationDispatcher notificationDispatcher;
    private final TransactionTemplate transactionTemplate;

    /**
     * Applies a gateway result.
     *
     * <p>SUCCESS marks the order, booking or boost purchase paid as SYSTEM. FAILURE fails a
     * boost purchase; orders and bookings stay in pending_payment and their buyer is notified.
     *
     * @throws EntityNotFoundException if no session exists for the reference
     * @throws com.nosota.tradeflow.error.InvalidTransitionException if the entity can no longer be paid
     */
    public PaymentResultResponse onPaymentResult(PaymentResultRequest request) {
        return transactionTemplate.execute(status -> {
            PaymentSession session = paymentSessionRepository.findByIdForUpdate(request.referenceId())
                    .orElseThrow(() -> new EntityNotFoundException("PAYMENT_SESSION", request.referenceId()));

            if (session.getStatus() != PaymentSessionStatus.OPEN) {
                log.info("Payment session {} already {}, ignoring repeated {} callback",
                        session.getId(), session.getStatus(), request.outcome());
                EntitySnapshot snapshot = workflowEngine.snapshot(session.getEntityType(), session.getEntityId());
                return new PaymentResultResponse(session.getId(), session.getEntityType(), session.getEntityId(),
                        snapshot.status(), true);
            }

            String entityStatus;
            if (request.outcome() == PaymentOutcome.SUCCESS) {
                TransitionResult result = workflowEngine.applyTransition(session.getEntityType(), session.getEntityId(),
                        WorkflowAction.MARK_PAID, null, ActorRole.SYSTEM,
                        TransitionPayload.withPaymentReference(request.transactionRef()));
                entityStatus = result.status();
                session.setStatus(PaymentSessionStatus.SUCCEEDED);
            } else {
                entityStatus = onFailure(session);
                session.setStatus(PaymentSessionStatus.FAILED);
            }

            session.setTransactionRef(request.transactionRef());
            session.setCompletedAt(LocalDateTime.now());
            paymentSessionRepository.save(session);

            log.info("Payment session {} settled as {} for {} {} (now {})", session.getId(), session.getStatus(),
                    session.getEntityType(), session.getEntityId(), entityStatus);
            return new PaymentResultResponse(session.getId(), session.getEntityType(), session.getEntityId(),
                    entityStatus, false);
        });
    }

    private String onFailure(PaymentSession session) {
        if (session.getEntityType() == EntityType.BOOST_PURCHASE) {
            return workflowEngine.applyTransition(EntityType.BOOST_PURCHASE, session.getEntityId(),
                    WorkflowAction.FAIL, null, ActorRole.SYSTEM, TransitionPayload.empty()).status();
        }

        EntitySnapshot snapshot = workflowEngine.snapshot(session.getEntityType(), session.getEntityId());
        String link = (session.getEntityType() == EntityType.ORDER ? "/orders/" : "/bookings/") + session.getEntityId();
        notificationDispatcher.dispatch(snapshot.buyerId(), NotificationType.PAYMENT_FAILED,
                "Payment failed", "Your payment of " + session.getAmount() + " did not go through", link);
        log.warn("Payment failed for {} {}, left in {}", session.getEntityType(), session.getEntityId(),
                snapshot.status());
        return snapshot.status();
    }
}

package com.nosota.tradeflow.tests;

import com.nosota.tradeflow.TestBase;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.LedgerEntryType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.OrderStatus;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.api.response.MessageResponse;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.error.InvalidTransitionException;
import com.nosota.tradeflow.model.LedgerEntry;
import com.nosota.tradeflow.model.Order;
import com.nosota.tradeflow.repository.OrderRepository;
import com.nosota.tradeflow.workflow.SideEffect;
import com.nosota.tradeflow.workflow.TransitionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Order lifecycle against a real database: transitions, their messages, notifications and the
 * commission entry written on delivery.
 */
public class OrderWorkflowTest extends TestBase {

    @Autowired
    private OrderRepository orderRepository;

    private Long buyerId;
    private Long sellerId;

    @BeforeEach
    public void setupParties() {
        buyerId = newUserId();
        sellerId = newUserId();
    }

    @Test
    public void placeOrder_opensConversationAndNotifiesSeller() {
        Order order = placeOrder(buyerId, sellerId);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING_PAYMENT);
        assertThat(order.getConversationId()).isNotNull();
        assertThat(order.getTotalAmount()).isEqualByComparingTo("110.00");
        assertThat(order.getPaymentLink()).isNull();

        List<MessageResponse> messages = conversationService.listMessages(order.getConversationId(), buyerId,
                ActorRole.BUYER, 0, 50);
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).system()).isTrue();
        assertThat(notificationTypesOf(sellerId)).contains(NotificationType.ORDER_CREATED);
    }

    @Test
    public void ipgOrder_getsPaymentLink() {
        Order order = placeOrder(buyerId, sellerId, PaymentMethod.IPG);

        assertThat(order.getPaymentLink()).startsWith("https://pay.test/session");
    }

    @Test
    public void fullLifecycle_recordsCommissionOnDelivery() {
        Order order = placeOrder(buyerId, sellerId);

        deliver(order);

        Order delivered = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(delivered.getStatus()).isEqualTo(OrderStatus.DELIVERED);
        assertThat(delivered.getPaidAt()).isNotNull();
        assertThat(delivered.getShippedAt()).isNotNull();
        assertThat(delivered.getTrackingNumber()).isEqualTo("TRK-1");
        assertThat(delivered.getPaymentReference()).startsWith("BANK-");

        List<LedgerEntry> ledger = commissionLedgerService.listEntries(EntityType.ORDER, order.getId());
        assertThat(ledger).hasSize(1);
        LedgerEntry payout = ledger.get(0);
        assertThat(payout.getEntryType()).isEqualTo(LedgerEntryType.PAYOUT);
        assertThat(payout.getAmount()).isEqualByComparingTo("100.00");
        assertThat(payout.getCommissionAmount()).isEqualByComparingTo("20.00");
        assertThat(payout.getSellerPayout()).isEqualByComparingTo("80.00");

        List<MessageResponse> messages = conversationService.listMessages(order.getConversationId(), sellerId,
                ActorRole.SELLER, 0, 50);
        assertThat(messages).extracting(MessageResponse::sequenceNumber)
                .containsExactly(1L, 2L, 3L, 4L, 5L, 6L);
        assertThat(notificationTypesOf(buyerId)).contains(
                NotificationType.ORDER_PAID, NotificationType.ORDER_SHIPPED, NotificationType.ORDER_DELIVERED);
    }

    @Test
    public void bankSlip_isRecordedWithoutChangingStatus() {
        Order order = placeOrder(buyerId, sellerId);

        TransitionResult result = workflowEngine.applyTransition(EntityType.ORDER, order.getId(),
                WorkflowAction.SUBMIT_PAYMENT, buyerId, ActorRole.BUYER,
                new TransitionPayload(null, null, null, null, null, null, null, "https://files.test/slip.png", null));

        assertThat(result.status()).isEqualTo("PENDING_PAYMENT");
        assertThat(result.noOp()).isFalse();
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getPaymentSlipUrl())
                .isEqualTo("https://files.test/slip.png");
        assertThat(notificationTypesOf(sellerId)).contains(NotificationType.ORDER_PAYMENT_SUBMITTED);
    }

    @Test
    public void buyerCannotMarkOwnOrderPaid() {
        Order order = placeOrder(buyerId, sellerId);

        assertThatThrownBy(() -> workflowEngine.applyTransition(EntityType.ORDER, order.getId(),
                WorkflowAction.MARK_PAID, buyerId, ActorRole.BUYER, null))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.PENDING_PAYMENT);
    }

    @Test
    public void anotherSellerCannotTouchTheOrder() {
        Order order = placeOrder(buyerId, sellerId);

        assertThatThrownBy(() -> workflowEngine.applyTransition(EntityType.ORDER, order.getId(),
                WorkflowAction.CANCEL, newUserId(), ActorRole.SELLER, null))
                .isInstanceOf(ActorNotAuthorizedException.class);
    }

    @Test
    public void cancelledOrderIsTerminal() {
        Order order = placeOrder(buyerId, sellerId);

        TransitionResult cancelled = workflowEngine.applyTransition(EntityType.ORDER, order.getId(),
                WorkflowAction.CANCEL, buyerId, ActorRole.BUYER, TransitionPayload.withNotes("changed my mind"));
        assertThat(cancelled.status()).isEqualTo("CANCELLED");
        assertThat(cancelled.sideEffects()).extracting(SideEffect::type)
                .contains(SideEffectType.SYSTEM_MESSAGE_POSTED, SideEffectType.NOTIFICATION_QUEUED);

        assertThatThrownBy(() -> workflowEngine.applyTransition(EntityType.ORDER, order.getId(),
                WorkflowAction.MARK_PAID, ADMIN_ID, ActorRole.ADMIN, null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    public void redeliveringDoesNotDoubleThePayout() {
        Order order = placeOrder(buyerId, sellerId);
        deliver(order);

        BigDecimal before = commissionLedgerService.listEntries(EntityType.ORDER, order.getId()).get(0).getAmount();
        commissionLedgerService.recordPayout(EntityType.ORDER, order.getId(), sellerId, new BigDecimal("999.00"));

        List<LedgerEntry> ledger = commissionLedgerService.listEntries(EntityType.ORDER, order.getId());
        assertThat(ledger).hasSize(1);
        assertThat(ledger.get(0).getAmount()).isEqualByComparingTo(before);
    }
}

package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.OrderStatus;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.error.ConcurrentModificationException;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.error.InvalidTransitionException;
import com.nosota.tradeflow.model.Order;
import com.nosota.tradeflow.repository.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Engine behaviour around a real order handler with stubbed persistence.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowEngineTest {

    private static final Long BUYER = 100L;
    private static final Long SELLER = 200L;
    private static final Long ADMIN = 900L;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private SideEffectFactory sideEffects;

    @Mock
    private TransactionTemplate transactionTemplate;

    private WorkflowEngine engine;
    private UUID orderId;

    @BeforeEach
    void setUp() {
        orderId = UUID.randomUUID();
        OrderWorkflowHandler handler = new OrderWorkflowHandler(sideEffects, orderRepository);
        engine = new WorkflowEngine(List.of(handler), transactionTemplate);

        lenient().when(transactionTemplate.execute(any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(0);
            return callback.doInTransaction(null);
        });
        lenient().when(sideEffects.systemMessage(any(), anyString())).thenAnswer(invocation -> (SideEffectTask) () ->
                new SideEffect(SideEffectType.SYSTEM_MESSAGE_POSTED, UUID.randomUUID(), invocation.getArgument(1)));
        lenient().when(sideEffects.notification(any(), any(), any(), any(), any(), any()))
                .thenAnswer(invocation -> (SideEffectTask) () ->
                        new SideEffect(SideEffectType.NOTIFICATION_QUEUED, orderId, "user " + invocation.getArgument(0)));
        lenient().when(orderRepository.saveAndFlush(any(Order.class))).thenAnswer(invocation -> {
            Order saved = invocation.getArgument(0);
            saved.setVersion(saved.getVersion() + 1);
            return saved;
        });
    }

    @Test
    void adminMarksOrderPaid() {
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order(OrderStatus.PENDING_PAYMENT)));

        TransitionResult result = engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.MARK_PAID,
                ADMIN, ActorRole.ADMIN, TransitionPayload.withPaymentReference("TRX-1"));

        assertThat(result.previousStatus()).isEqualTo("PENDING_PAYMENT");
        assertThat(result.status()).isEqualTo("PAID");
        assertThat(result.noOp()).isFalse();
        assertThat(result.version()).isEqualTo(2L);
        assertThat(result.sideEffects()).extracting(SideEffect::type)
                .containsExactly(SideEffectType.SYSTEM_MESSAGE_POSTED,
                        SideEffectType.NOTIFICATION_QUEUED,
                        SideEffectType.NOTIFICATION_QUEUED);
    }

    @Test
    void actorIsNotNotifiedOfTheirOwnMove() {
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order(OrderStatus.PAID)));

        TransitionResult result = engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.START_PROCESSING,
                SELLER, ActorRole.SELLER, null);

        assertThat(result.status()).isEqualTo("PROCESSING");
        assertThat(result.sideEffects()).extracting(SideEffect::type)
                .containsExactly(SideEffectType.SYSTEM_MESSAGE_POSTED, SideEffectType.NOTIFICATION_QUEUED);
        verify(sideEffects, never()).notification(eq(SELLER), any(), any(), any(), any(), any());
    }

    @Test
    void sellerOfAnotherOrderIsRefused() {
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order(OrderStatus.PAID)));

        assertThatThrownBy(() -> engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.START_PROCESSING,
                999L, ActorRole.SELLER, null))
                .isInstanceOf(ActorNotAuthorizedException.class);
        verify(orderRepository, never()).saveAndFlush(any());
    }

    @Test
    void sellerCannotShip() {
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order(OrderStatus.PROCESSING)));

        assertThatThrownBy(() -> engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.SHIP,
                SELLER, ActorRole.SELLER, null))
                .isInstanceOfSatisfying(InvalidTransitionException.class, e -> {
                    assertThat(e.getCurrentState()).isEqualTo("PROCESSING");
                    assertThat(e.getRequestedState()).isEqualTo("SHIPPED");
                    assertThat(e.getActorRole()).isEqualTo(ActorRole.SELLER);
                });
    }

    @Test
    void shippingRequiresReadyToShip() {
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order(OrderStatus.PROCESSING)));

        assertThatThrownBy(() -> engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.SHIP,
                ADMIN, ActorRole.ADMIN, null))
                .isInstanceOfSatisfying(InvalidTransitionException.class,
                        e -> assertThat(e.getDetails()).containsKey("reason"));
        verify(orderRepository, never()).saveAndFlush(any());
    }

    @Test
    void repeatedReadyToShipIsNoOp() {
        Order order = order(OrderStatus.PROCESSING);
        order.setReadyToShip(true);
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order));

        TransitionResult result = engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.MARK_READY_TO_SHIP,
                SELLER, ActorRole.SELLER, null);

        assertThat(result.noOp()).isTrue();
        assertThat(result.status()).isEqualTo("PROCESSING");
        assertThat(result.sideEffects()).isEmpty();
        verify(orderRepository, never()).saveAndFlush(any());
    }

    @Test
    void deliveryQueuesSellerPayout() {
        Order order = order(OrderStatus.SHIPPED);
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order));
        when(sideEffects.payout(EntityType.ORDER, orderId, SELLER, new BigDecimal("50.00")))
                .thenReturn(() -> new SideEffect(SideEffectType.COMMISSION_RECORDED, UUID.randomUUID(), "payout"));

        TransitionResult result = engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.DELIVER,
                SELLER, ActorRole.SELLER, null);

        assertThat(result.status()).isEqualTo("DELIVERED");
        assertThat(order.getDeliveredAt()).isNotNull();
        assertThat(result.sideEffects()).extracting(SideEffect::type).contains(SideEffectType.COMMISSION_RECORDED);
    }

    @Test
    void lostRaceToTheSameTargetIsNoOp() {
        when(orderRepository.findById(orderId)).thenReturn(
                Optional.of(order(OrderStatus.PENDING_PAYMENT)),
                Optional.of(order(OrderStatus.PENDING_PAYMENT)),
                Optional.of(order(OrderStatus.PAID)));
        doThrow(new OptimisticLockingFailureException("stale order"))
                .when(orderRepository).saveAndFlush(any(Order.class));

        TransitionResult result = engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.MARK_PAID,
                null, ActorRole.SYSTEM, null);

        assertThat(result.noOp()).isTrue();
        assertThat(result.status()).isEqualTo("PAID");
        verify(orderRepository, times(1)).saveAndFlush(any(Order.class));
    }

    @Test
    void secondVersionConflictSurfaces() {
        when(orderRepository.findById(orderId)).thenAnswer(invocation -> Optional.of(order(OrderStatus.PAID)));
        doThrow(new OptimisticLockingFailureException("stale order"))
                .when(orderRepository).saveAndFlush(any(Order.class));

        assertThatThrownBy(() -> engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.START_PROCESSING,
                SELLER, ActorRole.SELLER, null))
                .isInstanceOf(ConcurrentModificationException.class);
        verify(orderRepository, times(2)).saveAndFlush(any(Order.class));
    }

    @Test
    void missingEntityIsReported() {
        when(orderRepository.findById(orderId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> engine.applyTransition(EntityType.ORDER, orderId, WorkflowAction.MARK_PAID,
                ADMIN, ActorRole.ADMIN, null))
                .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void entityTypeWithoutHandlerIsRejected() {
        assertThatThrownBy(() -> engine.applyTransition(EntityType.QUOTE, UUID.randomUUID(), WorkflowAction.ACCEPT,
                BUYER, ActorRole.BUYER, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void twoHandlersForOneTypeAreRejected() {
        OrderWorkflowHandler first = new OrderWorkflowHandler(sideEffects, orderRepository);
        OrderWorkflowHandler second = new OrderWorkflowHandler(sideEffects, orderRepository);

        assertThatThrownBy(() -> new WorkflowEngine(List.of(first, second), transactionTemplate))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void snapshotExposesStatusAndParties() {
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order(OrderStatus.SHIPPED)));

        EntitySnapshot snapshot = engine.snapshot(EntityType.ORDER, orderId);

        assertThat(snapshot.status()).isEqualTo("SHIPPED");
        assertThat(snapshot.buyerId()).isEqualTo(BUYER);
        assertThat(snapshot.sellerId()).isEqualTo(SELLER);
    }

    private Order order(OrderStatus status) {
        Order order = new Order();
        order.setId(orderId);
        order.setBuyerId(BUYER);
        order.setSellerId(SELLER);
        order.setProductId(UUID.randomUUID());
        order.setQuantity(2);
        order.setUnitPrice(new BigDecimal("25.00"));
        order.setShippingCost(new BigDecimal("5.00"));
        order.setPaymentMethod(PaymentMethod.BANK_TRANSFER);
        order.setStatus(status);
        order.setConversationId(UUID.randomUUID());
        order.setVersion(1L);
        return order;
    }
}

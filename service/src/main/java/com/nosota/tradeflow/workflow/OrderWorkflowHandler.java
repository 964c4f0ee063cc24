package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.OrderStatus;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.mapper.CommerceMapper;
import com.nosota.tradeflow.model.Order;
import com.nosota.tradeflow.repository.OrderRepository;
import com.nosota.tradeflow.statemachine.TransitionTable;
import com.nosota.tradeflow.statemachine.TransitionTables;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.UUID;

@Component
public class OrderWorkflowHandler extends AbstractWorkflowHandler<Order, OrderStatus> {

    private final OrderRepository orderRepository;

    public OrderWorkflowHandler(SideEffectFactory sideEffects, OrderRepository orderRepository) {
        super(sideEffects);
        this.orderRepository = orderRepository;
    }

    @Override
    public EntityType entityType() {
        return EntityType.ORDER;
    }

    @Override
    public TransitionTable<OrderStatus> table() {
        return TransitionTables.ORDER;
    }

    @Override
    public Order load(UUID id) {
        return orderRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.ORDER, id));
    }

    @Override
    public OrderStatus statusOf(Order order) {
        return order.getStatus();
    }

    @Override
    public void setStatus(Order order, OrderStatus status) {
        order.setStatus(status);
    }

    @Override
    public Long buyerOf(Order order) {
        return order.getBuyerId();
    }

    @Override
    public Long sellerOf(Order order) {
        return order.getSellerId();
    }

    @Override
    public UUID conversationOf(Order order) {
        return order.getConversationId();
    }

    @Override
    protected String linkOf(Order order) {
        return "/orders/" + order.getId();
    }

    @Override
    public void onTransition(Order order, TransitionContext ctx) {
        TransitionPayload payload = ctx.getPayload();
        LocalDateTime now = LocalDateTime.now();
        String ref = shortId(order);

        switch (ctx.getAction()) {
            case SUBMIT_PAYMENT -> {
                if (order.getPaymentMethod() != PaymentMethod.BANK_TRANSFER) {
                    throw guardFailed(order, ctx, "only bank transfer orders take a payment slip");
                }
                if (isBlank(payload.paymentSlipUrl()) && isBlank(payload.paymentReference())) {
                    throw guardFailed(order, ctx, "a payment slip or payment reference is required");
                }
                order.setPaymentSlipUrl(payload.paymentSlipUrl());
                order.setPaymentReference(payload.paymentReference());
                announce(order, ctx, "Payment slip submitted", NotificationType.ORDER_PAYMENT_SUBMITTED,
                        "Payment submitted", "Payment for order " + ref + " awaits verification");
            }
            case MARK_PAID -> {
                order.setPaidAt(now);
                if (!isBlank(payload.paymentReference())) {
                    order.setPaymentReference(payload.paymentReference());
                }
                announce(order, ctx, "Payment received", NotificationType.ORDER_PAID,
                        "Order paid", "Payment for order " + ref + " was received");
            }
            case START_PROCESSING -> announce(order, ctx, "Order is being processed",
                    NotificationType.ORDER_PROCESSING, "Order processing",
                    "Order " + ref + " is being prepared");
            case MARK_READY_TO_SHIP -> {
                if (order.isReadyToShip()) {
                    ctx.markNoOp();
                    return;
                }
                order.setReadyToShip(true);
                announce(order, ctx, "Order is ready to ship", NotificationType.ORDER_READY_TO_SHIP,
                        "Ready to ship", "Order " + ref + " is packed and waiting for pickup");
            }
            case SHIP -> {
                if (!order.isReadyToShip()) {
                    throw guardFailed(order, ctx, "the seller has not marked the order ready to ship");
                }
                order.setTrackingNumber(payload.trackingNumber());
                order.setCarrier(payload.carrier());
                order.setShippedAt(now);
                String tracking = isBlank(payload.trackingNumber()) ? "" : " (tracking " + payload.trackingNumber() + ")";
                announce(order, ctx, "Order shipped" + tracking, NotificationType.ORDER_SHIPPED,
                        "Order shipped", "Order " + ref + " is on its way" + tracking);
            }
            case DELIVER -> {
                order.setDeliveredAt(now);
                ctx.enqueue(sideEffects.payout(EntityType.ORDER, order.getId(), order.getSellerId(),
                        order.getItemsAmount()));
                announce(order, ctx, "Order delivered", NotificationType.ORDER_DELIVERED,
                        "Order delivered", "Order " + ref + " was delivered");
            }
            case CANCEL -> {
                order.setCancelledAt(now);
                String reason = isBlank(ctx.notes()) ? "" : ": " + ctx.notes();
                announce(order, ctx, "Order cancelled by " + ctx.getActorRole().name().toLowerCase() + reason,
                        NotificationType.ORDER_CANCELLED, "Order cancelled", "Order " + ref + " was cancelled" + reason);
            }
            default -> throw guardFailed(order, ctx, "no order behaviour for " + ctx.getAction());
        }
    }

    @Override
    public Order save(Order order) {
        return orderRepository.saveAndFlush(order);
    }

    @Override
    public Long versionOf(Order order) {
        return order.getVersion();
    }

    @Override
    public Object toResponse(Order order) {
        return CommerceMapper.INSTANCE.toResponse(order);
    }

    private static String shortId(Order order) {
        return "#" + order.getId().toString().substring(0, 8);
    }
}

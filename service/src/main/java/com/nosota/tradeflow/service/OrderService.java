package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.ConversationType;
import com.nosota.tradeflow.api.model.DesignApprovalStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.OrderStatus;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.api.request.CreateOrderRequest;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.model.Conversation;
import com.nosota.tradeflow.model.DesignApproval;
import com.nosota.tradeflow.model.Order;
import com.nosota.tradeflow.model.PaymentSession;
import com.nosota.tradeflow.model.Quote;
import com.nosota.tradeflow.repository.DesignApprovalRepository;
import com.nosota.tradeflow.repository.OrderRepository;
import com.nosota.tradeflow.repository.QuoteRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderService {

    private final OrderRepository orderRepository;
    private final QuoteRepository quoteRepository;
    private final DesignApprovalRepository designApprovalRepository;
    private final ConversationService conversationService;
    private final PaymentSessionService paymentSessionService;
    private final NotificationDispatcher notificationDispatcher;

    /**
     * Places an order in PENDING_PAYMENT and opens its conversation.
     *
     * <p>An order built on a quote takes the quote's seller, unit price and quantity; the quote
     * must be accepted and belong to the buyer. A linked design must be approved.
     *
     * @throws IllegalStateException if the linked quote or design is not in a usable state
     */
    @Transactional
    public Order createOrder(Long actorId, ActorRole actorRole, CreateOrderRequest request) {
        ActorAccess.requireRole(EntityType.ORDER, null, actorId, actorRole, ActorRole.BUYER, "create");

        Order order = new Order();
        order.setBuyerId(actorId);
        order.setSellerId(request.sellerId());
        order.setProductId(request.productId());
        order.setProductVariantId(request.productVariantId());
        order.setQuantity(request.quantity());
        order.setUnitPrice(request.unitPrice());

        if (request.quoteId() != null) {
            Quote quote = quoteRepository.findById(request.quoteId())
                    .orElseThrow(() -> new EntityNotFoundException(EntityType.QUOTE, request.quoteId()));
            if (quote.getStatus() != QuoteStatus.ACCEPTED) {
                throw new IllegalStateException("Quote " + quote.getId() + " is " + quote.getStatus() + ", not ACCEPTED");
            }
            ActorAccess.requireParty(EntityType.QUOTE, quote.getId(), quote.getBuyerId(), null,
                    actorId, actorRole, "order from");
            if (!request.productId().equals(quote.getProductId())) {
                throw new IllegalArgumentException("Quote " + quote.getId() + " does not cover product " + request.productId());
            }
            order.setSellerId(quote.getSellerId());
            order.setUnitPrice(quote.getQuotedPrice());
            order.setQuantity(quote.getQuantity());
            if (quote.getProductVariantId() != null) {
                order.setProductVariantId(quote.getProductVariantId());
            }
            order.setQuoteId(quote.getId());
        }

        if (request.designApprovalId() != null) {
            DesignApproval design = designApprovalRepository.findById(request.designApprovalId())
                    .orElseThrow(() -> new EntityNotFoundException(EntityType.DESIGN_APPROVAL, request.designApprovalId()));
            if (design.getStatus() != DesignApprovalStatus.APPROVED) {
                throw new IllegalStateException("Design approval " + design.getId() + " is " + design.getStatus()
                        + ", not APPROVED");
            }
            ActorAccess.requireParty(EntityType.DESIGN_APPROVAL, design.getId(), design.getBuyerId(), null,
                    actorId, actorRole, "order from");
            order.setDesignApprovalId(design.getId());
        }

        order.setShippingCost(request.shippingCost() == null ? BigDecimal.ZERO : request.shippingCost());
        order.setShippingAddress(request.shippingAddress());
        order.setPaymentMethod(request.paymentMethod());
        order.setStatus(OrderStatus.PENDING_PAYMENT);
        order.setReadyToShip(false);
        order = orderRepository.saveAndFlush(order);

        Conversation conversation = conversationService.openLinkedConversation(ConversationType.ORDER,
                order.getBuyerId(), order.getSellerId(), "Order #" + order.getId().toString().substring(0, 8),
                order.getId(), null);
        order.setConversationId(conversation.getId());

        if (order.getPaymentMethod() == PaymentMethod.IPG) {
            PaymentSession session = paymentSessionService.requestSession(EntityType.ORDER, order.getId(),
                    order.getTotalAmount());
            order.setPaymentLink(session.getSessionUrl());
        }
        Order saved = orderRepository.saveAndFlush(order);

        conversationService.postSystemMessage(conversation.getId(),
                "Order placed: " + saved.getQuantity() + " x " + saved.getUnitPrice() + ", total " + saved.getTotalAmount());
        notificationDispatcher.dispatch(saved.getSellerId(), NotificationType.ORDER_CREATED,
                "New order", "You received an order for " + saved.getQuantity() + " unit(s)", "/orders/" + saved.getId());

        log.info("Order {} placed by buyer {} with seller {}, total {} ({})", saved.getId(), actorId,
                saved.getSellerId(), saved.getTotalAmount(), saved.getPaymentMethod());
        return saved;
    }

    public Order getOrder(UUID orderId, Long actorId, ActorRole actorRole) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.ORDER, orderId));
        ActorAccess.requireParty(EntityType.ORDER, orderId, order.getBuyerId(), order.getSellerId(),
                actorId, actorRole, "read");
        return order;
    }
}

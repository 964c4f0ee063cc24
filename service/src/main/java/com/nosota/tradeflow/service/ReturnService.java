package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.BookingStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.OrderStatus;
import com.nosota.tradeflow.api.model.ReturnRequestStatus;
import com.nosota.tradeflow.api.model.SellerResponseStatus;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.CreateReturnRequest;
import com.nosota.tradeflow.error.AttemptLimitExceededException;
import com.nosota.tradeflow.error.DuplicateActiveResourceException;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.error.InvalidTransitionException;
import com.nosota.tradeflow.model.Booking;
import com.nosota.tradeflow.model.Order;
import com.nosota.tradeflow.model.ReturnRequest;
import com.nosota.tradeflow.repository.BookingRepository;
import com.nosota.tradeflow.repository.OrderRepository;
import com.nosota.tradeflow.repository.ReturnRequestRepository;
import com.nosota.tradeflow.statemachine.TransitionTables;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Files return attempts against delivered orders and paid bookings.
 *
 * <p>Each attempt is a separate row numbered 1..max per order or booking. Once refunds reach
 * the amount paid no further attempt can be filed. The parent's attempt
 * counter is incremented under its version check in the same transaction, so two concurrent
 * filings cannot both take the same attempt number.
 */
@Service
@Slf4j
public class ReturnService {

    private static final EnumSet<BookingStatus> RETURNABLE_BOOKING =
            EnumSet.of(BookingStatus.PAID, BookingStatus.ONGOING, BookingStatus.COMPLETED);

    private final ReturnRequestRepository returnRequestRepository;
    private final OrderRepository orderRepository;
    private final BookingRepository bookingRepository;
    private final ConversationService conversationService;
    private final NotificationDispatcher notificationDispatcher;
    private final int maxAttempts;

    public ReturnService(ReturnRequestRepository returnRequestRepository, OrderRepository orderRepository,
                         BookingRepository bookingRepository, ConversationService conversationService,
                         NotificationDispatcher notificationDispatcher,
                         @Value("${workflow.returns.max-attempts:3}") int maxAttempts) {
        this.returnRequestRepository = returnRequestRepository;
        this.orderRepository = orderRepository;
        this.bookingRepository = bookingRepository;
        this.conversationService = conversationService;
        this.notificationDispatcher = notificationDispatcher;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Files the next return attempt for an order or booking.
     *
     * @throws IllegalArgumentException         unless exactly one of orderId/bookingId is set
     * @throws InvalidTransitionException       if the order is not delivered or the booking not paid
     * @throws AttemptLimitExceededException    if all attempts are used
     * @throws DuplicateActiveResourceException if the previous attempt is still open
     */
    @Transactional
    public ReturnRequest fileReturn(Long actorId, ActorRole actorRole, CreateReturnRequest request) {
        if ((request.orderId() == null) == (request.bookingId() == null)) {
            throw new IllegalArgumentException("A return refers to exactly one of orderId or bookingId");
        }
        ActorAccess.requireRole(EntityType.RETURN_REQUEST, null, actorId, actorRole, ActorRole.BUYER, "file");

        ReturnRequest returnRequest = new ReturnRequest();
        Optional<ReturnRequest> latest;
        int attempts;

        if (request.orderId() != null) {
            Order order = orderRepository.findById(request.orderId())
                    .orElseThrow(() -> new EntityNotFoundException(EntityType.ORDER, request.orderId()));
            ActorAccess.requireParty(EntityType.ORDER, order.getId(), order.getBuyerId(), null,
                    actorId, actorRole, "return");
            if (order.getStatus() != OrderStatus.DELIVERED) {
                throw new InvalidTransitionException(EntityType.ORDER, order.getId(), order.getStatus(),
                        WorkflowAction.REQUEST_RETURN, ReturnRequestStatus.REQUESTED, actorRole,
                        "only delivered orders can be returned");
            }
            requireRefundable(EntityType.ORDER, order.getId(), order.getStatus(), order.getTotalAmount(), actorRole);
            attempts = order.getReturnAttemptCount();
            checkAttempts(EntityType.ORDER, order.getId(), attempts);
            latest = returnRequestRepository.findFirstByOrderIdOrderByAttemptNumberDesc(order.getId());
            checkNoOpenAttempt(order.getId(), latest);

            order.setReturnAttemptCount(attempts + 1);
            orderRepository.saveAndFlush(order);

            returnRequest.setOrderId(order.getId());
            returnRequest.setConversationId(order.getConversationId());
            returnRequest.setBuyerId(order.getBuyerId());
            returnRequest.setSellerId(order.getSellerId());
        } else {
            Booking booking = bookingRepository.findById(request.bookingId())
                    .orElseThrow(() -> new EntityNotFoundException(EntityType.BOOKING, request.bookingId()));
            ActorAccess.requireParty(EntityType.BOOKING, booking.getId(), booking.getBuyerId(), null,
                    actorId, actorRole, "return");
            if (!RETURNABLE_BOOKING.contains(booking.getStatus())) {
                throw new InvalidTransitionException(EntityType.BOOKING, booking.getId(), booking.getStatus(),
                        WorkflowAction.REQUEST_RETURN, ReturnRequestStatus.REQUESTED, actorRole,
                        "only paid, ongoing or completed bookings can be disputed");
            }
            requireRefundable(EntityType.BOOKING, booking.getId(), booking.getStatus(), booking.getAmount(), actorRole);
            attempts = booking.getReturnAttemptCount();
            checkAttempts(EntityType.BOOKING, booking.getId(), attempts);
            latest = returnRequestRepository.findFirstByBookingIdOrderByAttemptNumberDesc(booking.getId());
            checkNoOpenAttempt(booking.getId(), latest);

            booking.setReturnAttemptCount(attempts + 1);
            bookingRepository.saveAndFlush(booking);

            returnRequest.setBookingId(booking.getId());
            returnRequest.setConversationId(booking.getConversationId());
            returnRequest.setBuyerId(booking.getBuyerId());
            returnRequest.setSellerId(booking.getSellerId());
        }

        returnRequest.setAttemptNumber(attempts + 1);
        returnRequest.setReason(request.reason());
        returnRequest.setDescription(request.description());
        returnRequest.setEvidenceUrls(request.evidenceUrls() == null
                ? new ArrayList<>() : new ArrayList<>(request.evidenceUrls()));
        returnRequest.setRequestedRefundAmount(request.requestedRefundAmount());
        returnRequest.setStatus(ReturnRequestStatus.REQUESTED);
        returnRequest.setSellerStatus(SellerResponseStatus.PENDING);

        ReturnRequest saved = returnRequestRepository.saveAndFlush(returnRequest);
        if (saved.getConversationId() != null) {
            conversationService.postSystemMessage(saved.getConversationId(),
                    "Return #" + saved.getAttemptNumber() + " requested (" + saved.getReason().name().toLowerCase()
                            + "), refund " + saved.getRequestedRefundAmount());
        }
        notificationDispatcher.dispatch(saved.getSellerId(), NotificationType.RETURN_REQUESTED,
                "Return requested", "The buyer filed return #" + saved.getAttemptNumber(), "/returns/" + saved.getId());

        log.info("Return {} (attempt {}/{}) filed for {} {} by buyer {}", saved.getId(), saved.getAttemptNumber(),
                maxAttempts, saved.getParentType(), saved.getParentId(), actorId);
        return saved;
    }

    public ReturnRequest getReturn(UUID returnRequestId, Long actorId, ActorRole actorRole) {
        ReturnRequest request = returnRequestRepository.findById(returnRequestId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.RETURN_REQUEST, returnRequestId));
        ActorAccess.requireParty(EntityType.RETURN_REQUEST, returnRequestId, request.getBuyerId(),
                request.getSellerId(), actorId, actorRole, "read");
        return request;
    }

    /**
     * All attempts for an order or booking, oldest first.
     */
    public List<ReturnRequest> listReturnAttempts(EntityType parentType, UUID parentId, Long actorId,
                                                  ActorRole actorRole) {
        switch (parentType) {
            case ORDER -> {
                Order order = orderRepository.findById(parentId)
                        .orElseThrow(() -> new EntityNotFoundException(EntityType.ORDER, parentId));
                ActorAccess.requireParty(EntityType.ORDER, parentId, order.getBuyerId(), order.getSellerId(),
                        actorId, actorRole, "read returns of");
                return returnRequestRepository.findByOrderIdOrderByAttemptNumberAsc(parentId);
            }
            case BOOKING -> {
                Booking booking = bookingRepository.findById(parentId)
                        .orElseThrow(() -> new EntityNotFoundException(EntityType.BOOKING, parentId));
                ActorAccess.requireParty(EntityType.BOOKING, parentId, booking.getBuyerId(), booking.getSellerId(),
                        actorId, actorRole, "read returns of");
                return returnRequestRepository.findByBookingIdOrderByAttemptNumberAsc(parentId);
            }
            default -> throw new IllegalArgumentException("Returns are filed against orders or bookings, not " + parentType);
        }
    }

    private void requireRefundable(EntityType parentType, UUID parentId, Enum<?> status, BigDecimal paid,
                                   ActorRole actorRole) {
        BigDecimal refunded = returnRequestRepository.totalRefunded(parentId);
        if (refunded.compareTo(paid) >= 0) {
            throw new InvalidTransitionException(parentType, parentId, status, WorkflowAction.REQUEST_RETURN,
                    ReturnRequestStatus.REQUESTED, actorRole, "the amount paid " + paid + " was already refunded");
        }
    }

    private void checkAttempts(EntityType parentType, UUID parentId, int attempts) {
        if (attempts >= maxAttempts) {
            log.warn("Return refused for {} {}: {} of {} attempts used", parentType, parentId, attempts, maxAttempts);
            throw new AttemptLimitExceededException(parentType, parentId, attempts, maxAttempts);
        }
    }

    private void checkNoOpenAttempt(UUID parentId, Optional<ReturnRequest> latest) {
        if (latest.isPresent() && !TransitionTables.RETURN_REQUEST.isTerminal(latest.get().getStatus())) {
            throw new DuplicateActiveResourceException("return request", parentId, latest.get().getId());
        }
    }
}

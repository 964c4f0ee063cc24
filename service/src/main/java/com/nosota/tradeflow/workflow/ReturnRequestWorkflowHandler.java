package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.BookingStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.ReturnRequestStatus;
import com.nosota.tradeflow.api.model.SellerResponseStatus;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.mapper.CommerceMapper;
import com.nosota.tradeflow.model.Booking;
import com.nosota.tradeflow.model.LedgerEntry;
import com.nosota.tradeflow.model.ReturnRequest;
import com.nosota.tradeflow.repository.BookingRepository;
import com.nosota.tradeflow.repository.OrderRepository;
import com.nosota.tradeflow.repository.ReturnRequestRepository;
import com.nosota.tradeflow.service.CommissionLedgerService;
import com.nosota.tradeflow.statemachine.TransitionTable;
import com.nosota.tradeflow.statemachine.TransitionTables;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Return and refund dispute moves. The seller responds first, an admin decides, and an approved
 * refund reverses the commission taken on the parent order or booking.
 *
 * <p>Refunds across all attempts never exceed what the buyer paid. A booking refunded before it
 * completed is cancelled, so it can no longer reach the payout.
 */
@Component
public class ReturnRequestWorkflowHandler extends AbstractWorkflowHandler<ReturnRequest, ReturnRequestStatus> {

    private static final EnumSet<BookingStatus> UNSETTLED_BOOKING = EnumSet.of(BookingStatus.PAID, BookingStatus.ONGOING);

    private final ReturnRequestRepository returnRequestRepository;
    private final OrderRepository orderRepository;
    private final BookingRepository bookingRepository;
    private final CommissionLedgerService commissionLedgerService;

    public ReturnRequestWorkflowHandler(SideEffectFactory sideEffects, ReturnRequestRepository returnRequestRepository,
                                        OrderRepository orderRepository, BookingRepository bookingRepository,
                                        CommissionLedgerService commissionLedgerService) {
        super(sideEffects);
        this.returnRequestRepository = returnRequestRepository;
        this.orderRepository = orderRepository;
        this.bookingRepository = bookingRepository;
        this.commissionLedgerService = commissionLedgerService;
    }

    @Override
    public EntityType entityType() {
        return EntityType.RETURN_REQUEST;
    }

    @Override
    public TransitionTable<ReturnRequestStatus> table() {
        return TransitionTables.RETURN_REQUEST;
    }

    @Override
    public ReturnRequest load(UUID id) {
        return returnRequestRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.RETURN_REQUEST, id));
    }

    @Override
    public ReturnRequestStatus statusOf(ReturnRequest request) {
        return request.getStatus();
    }

    @Override
    public void setStatus(ReturnRequest request, ReturnRequestStatus status) {
        request.setStatus(status);
    }

    @Override
    public Long buyerOf(ReturnRequest request) {
        return request.getBuyerId();
    }

    @Override
    public Long sellerOf(ReturnRequest request) {
        return request.getSellerId();
    }

    @Override
    public UUID conversationOf(ReturnRequest request) {
        return request.getConversationId();
    }

    @Override
    protected String linkOf(ReturnRequest request) {
        return "/returns/" + request.getId();
    }

    @Override
    public void onTransition(ReturnRequest request, TransitionContext ctx) {
        LocalDateTime now = LocalDateTime.now();
        String attempt = "Return #" + request.getAttemptNumber();

        switch (ctx.getAction()) {
            case START_REVIEW -> {
                request.setUnderReviewAt(now);
                announce(request, ctx, attempt + " is under review", NotificationType.RETURN_UNDER_REVIEW,
                        "Return under review", attempt + " is being reviewed by support");
            }
            case SELLER_APPROVE, SELLER_REJECT -> {
                boolean approved = ctx.getAction() == WorkflowAction.SELLER_APPROVE;
                if (!approved && isBlank(ctx.notes())) {
                    throw guardFailed(request, ctx, "a reason is required to reject a return");
                }
                BigDecimal proposed = ctx.getPayload().amount();
                if (proposed != null && proposed.compareTo(request.getRequestedRefundAmount()) > 0) {
                    throw guardFailed(request, ctx, "proposed refund exceeds the requested amount");
                }
                request.setSellerStatus(approved ? SellerResponseStatus.APPROVED : SellerResponseStatus.REJECTED);
                request.setSellerResponse(ctx.notes());
                request.setSellerProposedRefundAmount(approved && proposed == null
                        ? request.getRequestedRefundAmount() : proposed);
                request.setSellerRespondedAt(now);
                announce(request, ctx, "Seller " + (approved ? "accepted " : "declined ") + attempt,
                        NotificationType.RETURN_SELLER_RESPONDED, "Seller responded to return",
                        "The seller " + (approved ? "accepted" : "declined") + " " + attempt);
            }
            case ADMIN_APPROVE -> {
                BigDecimal amount = ctx.getPayload().amount();
                if (amount == null) {
                    throw guardFailed(request, ctx, "an approved refund amount is required");
                }
                BigDecimal paid = parentAmount(request);
                BigDecimal refundable = paid.subtract(returnRequestRepository.totalRefunded(request.getParentId()));
                if (amount.compareTo(refundable) > 0) {
                    throw guardFailed(request, ctx, "refund " + amount + " exceeds the refundable " + refundable
                            + " of the amount paid " + paid);
                }
                request.setApprovedRefundAmount(amount);
                request.setAdminNotes(ctx.notes());
                announce(request, ctx, attempt + " approved, refund " + amount, NotificationType.RETURN_APPROVED,
                        "Return approved", attempt + " was approved with a refund of " + amount);
            }
            case ADMIN_REJECT -> {
                request.setAdminNotes(ctx.notes());
                request.setResolvedAt(now);
                String reason = isBlank(ctx.notes()) ? "" : ": " + ctx.notes();
                announce(request, ctx, attempt + " rejected" + reason, NotificationType.RETURN_REJECTED,
                        "Return rejected", attempt + " was rejected" + reason);
            }
            case REFUND -> {
                Optional<LedgerEntry> reversal = commissionLedgerService.reverse(request.getParentType(),
                        request.getParentId(), request.getApprovedRefundAmount(), request.getId());
                request.setCommissionReversedAmount(reversal
                        .map(entry -> entry.getCommissionAmount().negate())
                        .orElse(BigDecimal.ZERO));
                reversal.ifPresent(entry -> ctx.record(new SideEffect(SideEffectType.COMMISSION_REVERSED,
                        entry.getId(), "commission " + entry.getCommissionAmount() + " on refund " + entry.getAmount())));
                if (request.getBookingId() != null) {
                    cancelUnsettledBooking(request, ctx, now);
                }
                request.setRefundedAt(now);
                request.setResolvedAt(now);
                announce(request, ctx, "Refund of " + request.getApprovedRefundAmount() + " processed",
                        NotificationType.REFUND_PROCESSED, "Refund processed",
                        "A refund of " + request.getApprovedRefundAmount() + " was processed for " + attempt);
            }
            case CLOSE -> {
                request.setResolvedAt(now);
                if (!isBlank(ctx.notes())) {
                    request.setAdminNotes(ctx.notes());
                }
                announce(request, ctx, attempt + " closed without refund", NotificationType.RETURN_COMPLETED,
                        "Return completed", attempt + " was resolved");
            }
            case CANCEL -> {
                request.setResolvedAt(now);
                announce(request, ctx, attempt + " withdrawn by the buyer", NotificationType.RETURN_CANCELLED,
                        "Return withdrawn", attempt + " was withdrawn");
            }
            default -> throw guardFailed(request, ctx, "no return behaviour for " + ctx.getAction());
        }
    }

    private void cancelUnsettledBooking(ReturnRequest request, TransitionContext ctx, LocalDateTime now) {
        Booking booking = bookingRepository.findById(request.getBookingId())
                .orElseThrow(() -> new EntityNotFoundException(EntityType.BOOKING, request.getBookingId()));
        if (!UNSETTLED_BOOKING.contains(booking.getStatus())) {
            return;
        }
        BookingStatus from = booking.getStatus();
        BookingStatus to = TransitionTables.BOOKING
                .resolve(booking.getId(), from, WorkflowAction.CANCEL, ActorRole.SYSTEM)
                .to();
        booking.setStatus(to);
        booking.setCancelledAt(now);
        bookingRepository.saveAndFlush(booking);

        String message = "The booking was cancelled after refund of return #" + request.getAttemptNumber();
        ctx.enqueue(sideEffects.systemMessage(booking.getConversationId(), "Booking cancelled after refund"));
        for (Long party : List.of(booking.getBuyerId(), booking.getSellerId())) {
            ctx.enqueue(sideEffects.notification(party, NotificationType.BOOKING_CANCELLED, "Booking cancelled",
                    message, "/bookings/" + booking.getId(), booking.getId()));
        }
        ctx.record(new SideEffect(SideEffectType.BOOKING_CANCELLED, booking.getId(),
                from.name().toLowerCase() + " -> " + to.name().toLowerCase() + " on refund"));
    }

    private BigDecimal parentAmount(ReturnRequest request) {
        if (request.getOrderId() != null) {
            return orderRepository.findById(request.getOrderId())
                    .orElseThrow(() -> new EntityNotFoundException(EntityType.ORDER, request.getOrderId()))
                    .getTotalAmount();
        }
        return bookingRepository.findById(request.getBookingId())
                .orElseThrow(() -> new EntityNotFoundException(EntityType.BOOKING, request.getBookingId()))
                .getAmount();
    }

    @Override
    public ReturnRequest save(ReturnRequest request) {
        return returnRequestRepository.saveAndFlush(request);
    }

    @Override
    public Long versionOf(ReturnRequest request) {
        return request.getVersion();
    }

    @Override
    public Object toResponse(ReturnRequest request) {
        return CommerceMapper.INSTANCE.toResponse(request);
    }
}

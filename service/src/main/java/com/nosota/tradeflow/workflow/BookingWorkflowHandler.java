package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.BookingStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.mapper.CommerceMapper;
import com.nosota.tradeflow.model.Booking;
import com.nosota.tradeflow.model.PaymentSession;
import com.nosota.tradeflow.repository.BookingRepository;
import com.nosota.tradeflow.service.PaymentSessionService;
import com.nosota.tradeflow.statemachine.TransitionTable;
import com.nosota.tradeflow.statemachine.TransitionTables;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Booking moves. A confirmation is immediately followed by the system move to
 * pending_payment, which opens a payment session for gateway bookings.
 */
@Component
public class BookingWorkflowHandler extends AbstractWorkflowHandler<Booking, BookingStatus> {

    private final BookingRepository bookingRepository;
    private final PaymentSessionService paymentSessionService;

    public BookingWorkflowHandler(SideEffectFactory sideEffects, BookingRepository bookingRepository,
                                  PaymentSessionService paymentSessionService) {
        super(sideEffects);
        this.bookingRepository = bookingRepository;
        this.paymentSessionService = paymentSessionService;
    }

    @Override
    public EntityType entityType() {
        return EntityType.BOOKING;
    }

    @Override
    public TransitionTable<BookingStatus> table() {
        return TransitionTables.BOOKING;
    }

    @Override
    public Booking load(UUID id) {
        return bookingRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.BOOKING, id));
    }

    @Override
    public BookingStatus statusOf(Booking booking) {
        return booking.getStatus();
    }

    @Override
    public void setStatus(Booking booking, BookingStatus status) {
        booking.setStatus(status);
    }

    @Override
    public Long buyerOf(Booking booking) {
        return booking.getBuyerId();
    }

    @Override
    public Long sellerOf(Booking booking) {
        return booking.getSellerId();
    }

    @Override
    public UUID conversationOf(Booking booking) {
        return booking.getConversationId();
    }

    @Override
    protected String linkOf(Booking booking) {
        return "/bookings/" + booking.getId();
    }

    @Override
    public Optional<WorkflowAction> followUp(Booking booking, BookingStatus reached) {
        return reached == BookingStatus.CONFIRMED ? Optional.of(WorkflowAction.REQUEST_PAYMENT) : Optional.empty();
    }

    @Override
    public void onTransition(Booking booking, TransitionContext ctx) {
        TransitionPayload payload = ctx.getPayload();
        LocalDateTime now = LocalDateTime.now();
        String when = booking.getScheduledDate() + (booking.getScheduledTime() == null ? "" : " " + booking.getScheduledTime());

        switch (ctx.getAction()) {
            case CONFIRM -> {
                booking.setConfirmedAt(now);
                announce(booking, ctx, "Booking confirmed", NotificationType.BOOKING_CONFIRMED,
                        "Booking confirmed", "Your booking for " + when + " was confirmed");
            }
            case REQUEST_PAYMENT -> {
                if (booking.getPaymentMethod() == PaymentMethod.IPG) {
                    PaymentSession session = paymentSessionService.requestSession(EntityType.BOOKING,
                            booking.getId(), booking.getAmount());
                    booking.setPaymentLink(session.getSessionUrl());
                    ctx.record(new SideEffect(SideEffectType.PAYMENT_SESSION_REQUESTED, session.getId(),
                            session.getSessionUrl()));
                }
                ctx.enqueue(sideEffects.systemMessage(booking.getConversationId(), "Awaiting payment"));
            }
            case SUBMIT_PAYMENT -> {
                if (booking.getPaymentMethod() != PaymentMethod.BANK_TRANSFER) {
                    throw guardFailed(booking, ctx, "only bank transfer bookings take a payment slip");
                }
                if (isBlank(payload.paymentSlipUrl()) && isBlank(payload.paymentReference())) {
                    throw guardFailed(booking, ctx, "a payment slip or payment reference is required");
                }
                booking.setPaymentSlipUrl(payload.paymentSlipUrl());
                booking.setPaymentReference(payload.paymentReference());
                announce(booking, ctx, "Payment slip submitted", NotificationType.BOOKING_PAYMENT_SUBMITTED,
                        "Payment submitted", "Payment for the booking on " + when + " awaits verification");
            }
            case MARK_PAID -> {
                booking.setPaidAt(now);
                if (!isBlank(payload.paymentReference())) {
                    booking.setPaymentReference(payload.paymentReference());
                }
                announce(booking, ctx, "Payment received", NotificationType.BOOKING_PAID,
                        "Booking paid", "Payment for the booking on " + when + " was received");
            }
            case START -> {
                booking.setStartedAt(now);
                announce(booking, ctx, "Service started", NotificationType.BOOKING_STARTED,
                        "Service started", "The service booked for " + when + " has started");
            }
            case COMPLETE -> {
                booking.setCompletedAt(now);
                ctx.enqueue(sideEffects.payout(EntityType.BOOKING, booking.getId(), booking.getSellerId(),
                        booking.getAmount()));
                announce(booking, ctx, "Service completed", NotificationType.BOOKING_COMPLETED,
                        "Service completed", "The service booked for " + when + " is complete");
            }
            case CANCEL -> {
                booking.setCancelledAt(now);
                String reason = isBlank(ctx.notes()) ? "" : ": " + ctx.notes();
                announce(booking, ctx, "Booking cancelled by " + ctx.getActorRole().name().toLowerCase() + reason,
                        NotificationType.BOOKING_CANCELLED, "Booking cancelled",
                        "The booking for " + when + " was cancelled" + reason);
            }
            default -> throw guardFailed(booking, ctx, "no booking behaviour for " + ctx.getAction());
        }
    }

    @Override
    public Booking save(Booking booking) {
        return bookingRepository.saveAndFlush(booking);
    }

    @Override
    public Long versionOf(Booking booking) {
        return booking.getVersion();
    }

    @Override
    public Object toResponse(Booking booking) {
        return CommerceMapper.INSTANCE.toResponse(booking);
    }
}

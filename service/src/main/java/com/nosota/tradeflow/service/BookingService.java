package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.BookingStatus;
import com.nosota.tradeflow.api.model.ConversationType;
import com.nosota.tradeflow.api.model.DesignApprovalStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.api.request.CreateBookingRequest;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.model.Booking;
import com.nosota.tradeflow.model.Conversation;
import com.nosota.tradeflow.model.DesignApproval;
import com.nosota.tradeflow.model.Quote;
import com.nosota.tradeflow.repository.BookingRepository;
import com.nosota.tradeflow.repository.DesignApprovalRepository;
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
public class BookingService {

    private final BookingRepository bookingRepository;
    private final QuoteRepository quoteRepository;
    private final DesignApprovalRepository designApprovalRepository;
    private final ConversationService conversationService;
    private final NotificationDispatcher notificationDispatcher;

    /**
     * Books a service in PENDING_CONFIRMATION and opens its conversation. A booking without a
     * package is a custom booking priced by an accepted quote.
     */
    @Transactional
    public Booking createBooking(Long actorId, ActorRole actorRole, CreateBookingRequest request) {
        ActorAccess.requireRole(EntityType.BOOKING, null, actorId, actorRole, ActorRole.BUYER, "create");
        if (request.packageId() == null && request.quoteId() == null) {
            throw new IllegalArgumentException("A booking without a package needs an accepted quote");
        }

        int quantity = request.quantity() == null ? 1 : request.quantity();
        Booking booking = new Booking();
        booking.setBuyerId(actorId);
        booking.setSellerId(request.sellerId());
        booking.setServiceId(request.serviceId());
        booking.setPackageId(request.packageId());
        booking.setScheduledDate(request.scheduledDate());
        booking.setScheduledTime(request.scheduledTime());
        booking.setAmount(request.amount());
        booking.setQuantity(quantity);
        booking.setNotes(request.notes());

        if (request.quoteId() != null) {
            Quote quote = quoteRepository.findById(request.quoteId())
                    .orElseThrow(() -> new EntityNotFoundException(EntityType.QUOTE, request.quoteId()));
            if (quote.getStatus() != QuoteStatus.ACCEPTED) {
                throw new IllegalStateException("Quote " + quote.getId() + " is " + quote.getStatus() + ", not ACCEPTED");
            }
            ActorAccess.requireParty(EntityType.QUOTE, quote.getId(), quote.getBuyerId(), null,
                    actorId, actorRole, "book from");
            if (!request.serviceId().equals(quote.getServiceId())) {
                throw new IllegalArgumentException("Quote " + quote.getId() + " does not cover service " + request.serviceId());
            }
            booking.setSellerId(quote.getSellerId());
            booking.setQuantity(quote.getQuantity());
            booking.setAmount(quote.getQuotedPrice().multiply(BigDecimal.valueOf(quote.getQuantity())));
            booking.setQuoteId(quote.getId());
        }

        if (request.designApprovalId() != null) {
            DesignApproval design = designApprovalRepository.findById(request.designApprovalId())
                    .orElseThrow(() -> new EntityNotFoundException(EntityType.DESIGN_APPROVAL, request.designApprovalId()));
            if (design.getStatus() != DesignApprovalStatus.APPROVED) {
                throw new IllegalStateException("Design approval " + design.getId() + " is " + design.getStatus()
                        + ", not APPROVED");
            }
            booking.setDesignApprovalId(design.getId());
        }

        booking.setPaymentMethod(request.paymentMethod());
        booking.setStatus(BookingStatus.PENDING_CONFIRMATION);
        booking = bookingRepository.saveAndFlush(booking);

        Conversation conversation = conversationService.openLinkedConversation(ConversationType.BOOKING,
                booking.getBuyerId(), booking.getSellerId(), "Booking for " + booking.getScheduledDate(),
                null, booking.getId());
        booking.setConversationId(conversation.getId());
        Booking saved = bookingRepository.saveAndFlush(booking);

        conversationService.postSystemMessage(conversation.getId(),
                "Booking requested for " + saved.getScheduledDate() + ", amount " + saved.getAmount());
        notificationDispatcher.dispatch(saved.getSellerId(), NotificationType.BOOKING_REQUESTED,
                "New booking request", "A buyer requested a booking for " + saved.getScheduledDate(),
                "/bookings/" + saved.getId());

        log.info("Booking {} requested by buyer {} with seller {} for {}", saved.getId(), actorId,
                saved.getSellerId(), saved.getScheduledDate());
        return saved;
    }

    public Booking getBooking(UUID bookingId, Long actorId, ActorRole actorRole) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.BOOKING, bookingId));
        ActorAccess.requireParty(EntityType.BOOKING, bookingId, booking.getBuyerId(), booking.getSellerId(),
                actorId, actorRole, "read");
        return booking;
    }
}

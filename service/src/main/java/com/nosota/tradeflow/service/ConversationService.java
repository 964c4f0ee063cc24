package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.ConversationStatus;
import com.nosota.tradeflow.api.model.ConversationType;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.AppendMessageRequest;
import com.nosota.tradeflow.api.request.CreateConversationRequest;
import com.nosota.tradeflow.api.response.MessageResponse;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.error.ConversationClosedException;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.error.InvalidTransitionException;
import com.nosota.tradeflow.mapper.ConversationMapper;
import com.nosota.tradeflow.model.Conversation;
import com.nosota.tradeflow.model.ConversationParticipant;
import com.nosota.tradeflow.model.Booking;
import com.nosota.tradeflow.model.Message;
import com.nosota.tradeflow.model.Order;
import com.nosota.tradeflow.realtime.ConversationSubscriberRegistry;
import com.nosota.tradeflow.realtime.MessageAppendedEvent;
import com.nosota.tradeflow.repository.AdvisoryLockRepository;
import com.nosota.tradeflow.repository.BookingRepository;
import com.nosota.tradeflow.repository.ConversationRepository;
import com.nosota.tradeflow.repository.MessageRepository;
import com.nosota.tradeflow.repository.OrderRepository;
import com.nosota.tradeflow.statemachine.TransitionTables;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Conversations and their messages.
 *
 * <p>Appending a message locks the conversation row, so sequence numbers are assigned one at
 * a time and are strictly increasing per conversation. The new message is handed to the
 * real-time broadcaster through a {@link MessageAppendedEvent} that is only delivered after
 * the transaction commits.
 *
 * <p>Read state is one marker per participant ({@code lastReadSequence}); unread count is
 * {@code lastSequenceNumber − lastReadSequence}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private static final ConversationMapper MAPPER = ConversationMapper.INSTANCE;

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final OrderRepository orderRepository;
    private final BookingRepository bookingRepository;
    private final AdvisoryLockRepository advisoryLockRepository;
    private final ConversationSubscriberRegistry subscriberRegistry;
    private final NotificationDispatcher notificationDispatcher;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${conversation.max-page-size:100}")
    private int maxPageSize;

    @Value("${conversation.max-history-batch:500}")
    private int maxHistoryBatch;

    /**
     * Opens a conversation, or returns the caller's existing active one for the same context.
     *
     * <p>Pre-purchase conversations carry exactly one of productId/serviceId matching their
     * type; order and booking conversations carry the matching id, and their buyer and seller
     * must be the parties of that order or booking. Lookup and insert run under an advisory
     * lock on the context, so concurrent requests end up with one conversation.
     */
    @Transactional
    public Conversation createConversation(Long actorId, ActorRole actorRole, CreateConversationRequest request) {
        boolean permitted = switch (actorRole) {
            case BUYER -> actorId.equals(request.buyerId());
            case SELLER -> actorId.equals(request.sellerId());
            case ADMIN -> true;
            case SYSTEM -> false;
        };
        if (!permitted) {
            throw new ActorNotAuthorizedException(EntityType.CONVERSATION, null, actorId, actorRole, "create");
        }
        validateContext(request);

        String contextKey = contextKey(request);
        if (contextKey != null) {
            advisoryLockRepository.lock(contextKey);
        }
        List<Conversation> reusable = findReusable(request);
        if (!reusable.isEmpty()) {
            Conversation existing = reusable.get(0);
            requireAccess(existing, actorId, actorRole);
            log.info("Reusing conversation {} for buyer {} ({})", existing.getId(), request.buyerId(), request.type());
            return existing;
        }

        Conversation conversation = new Conversation();
        conversation.setType(request.type());
        conversation.setSubject(request.subject());
        conversation.setStatus(ConversationStatus.ACTIVE);
        conversation.setBuyerId(request.buyerId());
        conversation.setSellerId(request.sellerId());
        conversation.setProductId(request.productId());
        conversation.setServiceId(request.serviceId());
        conversation.setOrderId(request.orderId());
        conversation.setBookingId(request.bookingId());
        conversation.setLastSequenceNumber(0L);
        conversation.addParticipant(request.buyerId(), ActorRole.BUYER);
        conversation.addParticipant(request.sellerId(), ActorRole.SELLER);
        if (actorRole == ActorRole.ADMIN) {
            conversation.addParticipant(actorId, ActorRole.ADMIN);
        }

        Conversation saved = conversationRepository.save(conversation);
        log.info("Conversation {} ({}) opened between buyer {} and seller {}",
                saved.getId(), saved.getType(), saved.getBuyerId(), saved.getSellerId());
        return saved;
    }

    /**
     * Opens the conversation attached to a new order or booking.
     */
    @Transactional
    public Conversation openLinkedConversation(ConversationType type, Long buyerId, Long sellerId, String subject,
                                               UUID orderId, UUID bookingId) {
        CreateConversationRequest request = new CreateConversationRequest(type, subject, buyerId, sellerId,
                null, null, orderId, bookingId);
        return createConversation(buyerId, ActorRole.BUYER, request);
    }

    public Conversation getConversation(UUID conversationId, Long actorId, ActorRole actorRole) {
        Conversation conversation = load(conversationId);
        requireAccess(conversation, actorId, actorRole);
        return conversation;
    }

    public Page<Conversation> listConversations(Long actorId, ActorRole actorRole, int page, int size) {
        PageRequest pageRequest = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), maxPageSize));
        if (actorRole == ActorRole.ADMIN) {
            return conversationRepository.findAllByActivity(pageRequest);
        }
        return conversationRepository.findByMember(actorId, pageRequest);
    }

    /**
     * Appends a user message.
     *
     * @throws ConversationClosedException if the conversation is resolved or archived and the
     *                                     sender is not an admin
     */
    @Transactional
    public MessageResponse appendMessage(UUID conversationId, Long actorId, ActorRole actorRole,
                                         AppendMessageRequest request) {
        boolean hasContent = request.content() != null && !request.content().isBlank();
        boolean hasAttachments = request.attachments() != null && !request.attachments().isEmpty();
        if (!hasContent && !hasAttachments) {
            throw new IllegalArgumentException("A message needs content or at least one attachment");
        }

        Conversation conversation = lock(conversationId);
        requireAccess(conversation, actorId, actorRole);
        if (conversation.isClosed() && actorRole != ActorRole.ADMIN) {
            log.warn("Rejected message from {} {} in {} conversation {}",
                    actorRole, actorId, conversation.getStatus(), conversationId);
            throw new ConversationClosedException(conversationId, conversation.getStatus());
        }

        ConversationParticipant sender = conversation.findParticipant(actorId)
                .orElseGet(() -> conversation.addParticipant(actorId, actorRole));

        Message message = newMessage(conversation, actorId, actorRole, false, request.content());
        if (hasAttachments) {
            message.setAttachments(new ArrayList<>(MAPPER.toAttachments(request.attachments())));
        }
        message = messageRepository.save(message);
        sender.setLastReadSequence(message.getSequenceNumber());
        conversationRepository.save(conversation);

        MessageResponse response = toResponse(message, conversation);
        notifyOfflineCounterparties(conversation, actorId, message);
        eventPublisher.publishEvent(new MessageAppendedEvent(conversationId, response));

        log.info("Message #{} appended to conversation {} by {} {}",
                message.getSequenceNumber(), conversationId, actorRole, actorId);
        return response;
    }

    /**
     * Posts a system message. System messages record workflow events and are accepted whatever
     * the conversation status.
     */
    @Transactional
    public Message postSystemMessage(UUID conversationId, String content) {
        Conversation conversation = lock(conversationId);
        Message message = messageRepository.save(newMessage(conversation, null, ActorRole.SYSTEM, true, content));
        conversationRepository.save(conversation);

        eventPublisher.publishEvent(new MessageAppendedEvent(conversationId, toResponse(message, conversation)));
        log.debug("System message #{} posted to conversation {}: {}",
                message.getSequenceNumber(), conversationId, content);
        return message;
    }

    /**
     * Messages after {@code afterSequence}, oldest first. Used for the initial load and for
     * backfill after a reconnect.
     */
    public List<MessageResponse> listMessages(UUID conversationId, Long actorId, ActorRole actorRole,
                                              long afterSequence, int limit) {
        Conversation conversation = getConversation(conversationId, actorId, actorRole);
        int batch = Math.min(Math.max(limit, 1), maxHistoryBatch);
        return messageRepository.findAfterSequence(conversationId, Math.max(afterSequence, 0L), PageRequest.of(0, batch))
                .stream()
                .map(m -> toResponse(m, conversation))
                .toList();
    }

    /**
     * Moves the caller's read marker to the latest message. Idempotent.
     *
     * @return unread count after the call
     */
    @Transactional
    public long markRead(UUID conversationId, Long actorId, ActorRole actorRole) {
        Conversation conversation = getConversation(conversationId, actorId, actorRole);
        ConversationParticipant participant = conversation.findParticipant(actorId)
                .orElseGet(() -> conversation.addParticipant(actorId, actorRole));

        if (participant.getLastReadSequence() < conversation.getLastSequenceNumber()) {
            participant.setLastReadSequence(conversation.getLastSequenceNumber());
            conversationRepository.save(conversation);
            log.debug("User {} read conversation {} up to #{}", actorId, conversationId,
                    conversation.getLastSequenceNumber());
        }
        return 0L;
    }

    public long unreadCount(UUID conversationId, Long actorId, ActorRole actorRole) {
        Conversation conversation = getConversation(conversationId, actorId, actorRole);
        long lastRead = conversation.findParticipant(actorId)
                .map(ConversationParticipant::getLastReadSequence)
                .orElse(0L);
        return Math.max(conversation.getLastSequenceNumber() - lastRead, 0L);
    }

    /**
     * Changes the conversation status.
     *
     * <p>An admin may resolve or archive. A buyer or seller asking for {@code resolved} only
     * records a resolution request for an admin to act on; any other request from them is
     * refused. Statuses only move forward.
     */
    @Transactional
    public Conversation updateStatus(UUID conversationId, Long actorId, ActorRole actorRole,
                                     ConversationStatus requested) {
        Conversation conversation = lock(conversationId);
        requireAccess(conversation, actorId, actorRole);

        if (actorRole == ActorRole.ADMIN || actorRole == ActorRole.SYSTEM) {
            return changeStatus(conversation, actorId, actorRole, requested);
        }
        if (requested == ConversationStatus.RESOLVED) {
            return requestResolution(conversation, actorId, actorRole);
        }
        throw new ActorNotAuthorizedException(EntityType.CONVERSATION, conversationId, actorId, actorRole,
                "set status " + requested.name().toLowerCase() + " of");
    }

    /**
     * Checks that the user may subscribe to the conversation in real time. Membership is read
     * from the database on every join.
     */
    public void requireJoinable(UUID conversationId, Long actorId, ActorRole actorRole) {
        getConversation(conversationId, actorId, actorRole);
    }

    public void requireAccess(Conversation conversation, Long actorId, ActorRole actorRole) {
        boolean permitted = switch (actorRole) {
            case ADMIN, SYSTEM -> true;
            case BUYER -> actorId.equals(conversation.getBuyerId());
            case SELLER -> actorId.equals(conversation.getSellerId());
        };
        if (!permitted) {
            throw new ActorNotAuthorizedException(EntityType.CONVERSATION, conversation.getId(), actorId,
                    actorRole, "access");
        }
    }

    public Conversation load(UUID conversationId) {
        return conversationRepository.findById(conversationId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.CONVERSATION, conversationId));
    }

    public Conversation lock(UUID conversationId) {
        return conversationRepository.findByIdForUpdate(conversationId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.CONVERSATION, conversationId));
    }

    private Conversation changeStatus(Conversation conversation, Long actorId, ActorRole actorRole,
                                      ConversationStatus requested) {
        ConversationStatus current = conversation.getStatus();
        if (current == requested) {
            return conversation;
        }
        WorkflowAction action = switch (requested) {
            case RESOLVED -> WorkflowAction.RESOLVE;
            case ARCHIVED -> WorkflowAction.ARCHIVE;
            case ACTIVE -> null;
        };
        if (action == null) {
            throw new InvalidTransitionException(EntityType.CONVERSATION, conversation.getId(), current,
                    null, requested, actorRole, "conversations cannot be reopened");
        }
        ConversationStatus next = TransitionTables.CONVERSATION
                .resolve(conversation.getId(), current, action, actorRole)
                .to();

        conversation.setStatus(next);
        if (actorRole == ActorRole.ADMIN && conversation.findParticipant(actorId).isEmpty()) {
            conversation.addParticipant(actorId, ActorRole.ADMIN);
        }
        conversationRepository.save(conversation);
        postSystemMessage(conversation.getId(), "Conversation " + next.name().toLowerCase() + " by admin");

        String title = "Conversation " + next.name().toLowerCase();
        for (Long party : List.of(conversation.getBuyerId(), conversation.getSellerId())) {
            notificationDispatcher.dispatch(party, NotificationType.CONVERSATION_STATUS_CHANGED, title,
                    conversationLabel(conversation) + " is now " + next.name().toLowerCase(),
                    linkOf(conversation));
        }
        log.info("Conversation {}: {} -> {} by {} {}", conversation.getId(), current, next, actorRole, actorId);
        return conversation;
    }

    private Conversation requestResolution(Conversation conversation, Long actorId, ActorRole actorRole) {
        if (conversation.isClosed()) {
            throw new ConversationClosedException(conversation.getId(), conversation.getStatus());
        }
        if (conversation.getResolutionRequestedAt() != null) {
            return conversation;
        }
        conversation.setResolutionRequestedAt(LocalDateTime.now());
        conversation.setResolutionRequestedBy(actorId);
        conversationRepository.save(conversation);

        postSystemMessage(conversation.getId(),
                "Resolution requested by the " + actorRole.name().toLowerCase());
        Long counterparty = actorRole == ActorRole.BUYER ? conversation.getSellerId() : conversation.getBuyerId();
        notificationDispatcher.dispatch(counterparty, NotificationType.CONVERSATION_RESOLUTION_REQUESTED,
                "Resolution requested", conversationLabel(conversation) + " was submitted for resolution",
                linkOf(conversation));
        log.info("Resolution of conversation {} requested by {} {}", conversation.getId(), actorRole, actorId);
        return conversation;
    }

    private Message newMessage(Conversation conversation, Long senderId, ActorRole senderRole, boolean system,
                               String content) {
        long sequence = conversation.getLastSequenceNumber() + 1;
        LocalDateTime now = LocalDateTime.now();
        conversation.setLastSequenceNumber(sequence);
        conversation.setLastMessageAt(now);

        Message message = new Message();
        message.setConversation(conversation);
        message.setSequenceNumber(sequence);
        message.setSenderId(senderId);
        message.setSenderRole(senderRole);
        message.setSystem(system);
        message.setContent(content);
        message.setCreatedAt(now);
        return message;
    }

    private void notifyOfflineCounterparties(Conversation conversation, Long senderId, Message message) {
        Set<Long> recipients = new LinkedHashSet<>();
        recipients.add(conversation.getBuyerId());
        recipients.add(conversation.getSellerId());
        conversation.getParticipants().forEach(p -> recipients.add(p.getUserId()));
        recipients.remove(senderId);

        String preview = message.getContent() == null ? "Sent an attachment" : abbreviate(message.getContent());
        for (Long recipient : recipients) {
            if (subscriberRegistry.isSubscribed(conversation.getId(), recipient)) {
                continue;
            }
            notificationDispatcher.dispatch(recipient, NotificationType.MESSAGE_RECEIVED, "New message",
                    preview, linkOf(conversation));
        }
    }

    private MessageResponse toResponse(Message message, Conversation conversation) {
        List<Long> readBy = conversation.getParticipants().stream()
                .filter(p -> p.getLastReadSequence() >= message.getSequenceNumber())
                .map(ConversationParticipant::getUserId)
                .toList();
        return MAPPER.toMessageResponse(message, readBy);
    }

    private static String conversationLabel(Conversation conversation) {
        return conversation.getSubject() != null ? "\"" + conversation.getSubject() + "\"" : "Your conversation";
    }

    private static String linkOf(Conversation conversation) {
        return "/conversations/" + conversation.getId();
    }

    private static String abbreviate(String content) {
        return content.length() <= 120 ? content : content.substring(0, 117) + "...";
    }

    private void validateContext(CreateConversationRequest request) {
        if (request.buyerId().equals(request.sellerId())) {
            throw new IllegalArgumentException("Buyer and seller must be different users");
        }
        ConversationType type = request.type();
        boolean hasProduct = request.productId() != null;
        boolean hasService = request.serviceId() != null;
        switch (type) {
            case PRE_PURCHASE_PRODUCT -> {
                if (!hasProduct || hasService) {
                    throw new IllegalArgumentException("A product pre-purchase conversation needs a productId and no serviceId");
                }
            }
            case PRE_PURCHASE_SERVICE -> {
                if (!hasService || hasProduct) {
                    throw new IllegalArgumentException("A service pre-purchase conversation needs a serviceId and no productId");
                }
            }
            case ORDER -> {
                if (request.orderId() == null) {
                    throw new IllegalArgumentException("An order conversation needs an orderId");
                }
                Order order = orderRepository.findById(request.orderId())
                        .orElseThrow(() -> new EntityNotFoundException(EntityType.ORDER, request.orderId()));
                requireSameParties(request, order.getBuyerId(), order.getSellerId(), "order " + order.getId());
            }
            case BOOKING -> {
                if (request.bookingId() == null) {
                    throw new IllegalArgumentException("A booking conversation needs a bookingId");
                }
                Booking booking = bookingRepository.findById(request.bookingId())
                        .orElseThrow(() -> new EntityNotFoundException(EntityType.BOOKING, request.bookingId()));
                requireSameParties(request, booking.getBuyerId(), booking.getSellerId(), "booking " + booking.getId());
            }
            case GENERAL_INQUIRY, COMPLAINT -> {
                if (hasProduct && hasService) {
                    throw new IllegalArgumentException("A conversation links at most one of productId and serviceId");
                }
            }
        }
    }

    private static void requireSameParties(CreateConversationRequest request, Long buyerId, Long sellerId,
                                           String context) {
        if (!buyerId.equals(request.buyerId()) || !sellerId.equals(request.sellerId())) {
            throw new IllegalArgumentException("Buyer and seller must be the parties of " + context);
        }
    }

    private static String contextKey(CreateConversationRequest request) {
        ConversationType type = request.type();
        if (type.isPrePurchase()) {
            Object item = request.productId() != null ? request.productId() : request.serviceId();
            return AdvisoryLockRepository.prePurchaseKey(request.buyerId(), request.sellerId(), item);
        }
        if (type == ConversationType.ORDER) {
            return "order-conversation:" + request.orderId();
        }
        if (type == ConversationType.BOOKING) {
            return "booking-conversation:" + request.bookingId();
        }
        return null;
    }

    private List<Conversation> findReusable(CreateConversationRequest request) {
        ConversationType type = request.type();
        if (type.isPrePurchase()) {
            return conversationRepository.findReusable(request.buyerId(), request.sellerId(), type,
                    request.productId(), request.serviceId(), List.of(ConversationStatus.ACTIVE));
        }
        if (type == ConversationType.ORDER) {
            return conversationRepository.findFirstByOrderIdOrderByCreatedAtAsc(request.orderId())
                    .map(List::of)
                    .orElse(List.of());
        }
        if (type == ConversationType.BOOKING) {
            return conversationRepository.findFirstByBookingIdOrderByCreatedAtAsc(request.bookingId())
                    .map(List::of)
                    .orElse(List.of());
        }
        return List.of();
    }
}

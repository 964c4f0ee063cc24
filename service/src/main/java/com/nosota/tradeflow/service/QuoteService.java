package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.api.request.CreateQuoteRequest;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.error.ConversationClosedException;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.model.Conversation;
import com.nosota.tradeflow.model.Quote;
import com.nosota.tradeflow.repository.QuoteRepository;
import com.nosota.tradeflow.workflow.WorkflowEngine;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Quote creation and reads. Status changes after creation go through the workflow engine.
 */
@Service
@Slf4j
public class QuoteService {

    private static final EnumSet<QuoteStatus> OPEN = EnumSet.of(QuoteStatus.PENDING, QuoteStatus.SENT);

    private final QuoteRepository quoteRepository;
    private final ConversationService conversationService;
    private final QuoteSupersession quoteSupersession;
    private final NotificationDispatcher notificationDispatcher;
    private final WorkflowEngine workflowEngine;
    private final int defaultValidityDays;

    public QuoteService(QuoteRepository quoteRepository, ConversationService conversationService,
                        QuoteSupersession quoteSupersession, NotificationDispatcher notificationDispatcher,
                        WorkflowEngine workflowEngine,
                        @Value("${workflow.quote.default-validity-days:7}") int defaultValidityDays) {
        this.quoteRepository = quoteRepository;
        this.conversationService = conversationService;
        this.quoteSupersession = quoteSupersession;
        this.notificationDispatcher = notificationDispatcher;
        this.workflowEngine = workflowEngine;
        this.defaultValidityDays = defaultValidityDays;
    }

    /**
     * Creates a quote in a conversation.
     *
     * <p>A seller creates a priced quote, SENT or PENDING for a draft, which supersedes the
     * conversation's other open quote. A buyer opens a REQUESTED quote for the seller to price.
     * The conversation row is locked for the duration, so concurrent creations serialize.
     *
     * @throws ActorNotAuthorizedException if the actor is not the conversation's buyer or seller
     * @throws ConversationClosedException if the conversation is resolved or archived
     * @throws IllegalArgumentException    if the item, price or expiry is invalid
     */
    @Transactional
    public Quote createQuote(Long actorId, ActorRole actorRole, CreateQuoteRequest request) {
        if (actorRole != ActorRole.BUYER && actorRole != ActorRole.SELLER) {
            throw new ActorNotAuthorizedException(EntityType.QUOTE, null, actorId, actorRole, "create");
        }
        Conversation conversation = conversationService.lock(request.conversationId());
        conversationService.requireAccess(conversation, actorId, actorRole);
        if (conversation.isClosed()) {
            throw new ConversationClosedException(conversation.getId(), conversation.getStatus());
        }
        if ((request.productId() == null) == (request.serviceId() == null)) {
            throw new IllegalArgumentException("A quote covers exactly one of productId or serviceId");
        }
        if (conversation.getSellerId() == null) {
            throw new IllegalStateException("Conversation " + conversation.getId() + " has no seller to quote");
        }

        LocalDateTime now = LocalDateTime.now();
        Quote quote = new Quote();
        quote.setConversationId(conversation.getId());
        quote.setBuyerId(conversation.getBuyerId());
        quote.setSellerId(conversation.getSellerId());
        quote.setProductId(request.productId());
        quote.setServiceId(request.serviceId());
        quote.setProductVariantId(request.productVariantId());
        quote.setServicePackageId(request.servicePackageId());
        quote.setQuantity(request.quantity());
        quote.setSpecifications(request.specifications());
        quote.setDesignApprovalId(request.designApprovalId());

        if (actorRole == ActorRole.SELLER) {
            BigDecimal price = request.quotedPrice();
            if (price == null || price.signum() <= 0) {
                throw new IllegalArgumentException("A seller quote needs a positive quoted price");
            }
            if (request.expiresAt() != null && !request.expiresAt().isAfter(now)) {
                throw new IllegalArgumentException("Quote expiry must be in the future");
            }
            quote.setQuotedPrice(price);
            quote.setExpiresAt(request.expiresAt() != null ? request.expiresAt() : now.plusDays(defaultValidityDays));
            quote.setStatus(request.draft() ? QuoteStatus.PENDING : QuoteStatus.SENT);
        } else {
            quote.setExpiresAt(request.expiresAt());
            quote.setStatus(QuoteStatus.REQUESTED);
        }

        Quote saved = quoteRepository.saveAndFlush(quote);
        if (OPEN.contains(saved.getStatus())) {
            quoteSupersession.supersedeOthers(conversation.getId(), saved.getId());
        }

        String link = "/quotes/" + saved.getId();
        if (saved.getStatus() == QuoteStatus.REQUESTED) {
            conversationService.postSystemMessage(conversation.getId(), "Quote requested for " + saved.getQuantity() + " unit(s)");
            notificationDispatcher.dispatch(saved.getSellerId(), NotificationType.QUOTE_REQUESTED,
                    "Quote requested", "A buyer asked you for a quote", link);
        } else {
            conversationService.postSystemMessage(conversation.getId(),
                    "Quote " + (saved.getStatus() == QuoteStatus.PENDING ? "drafted" : "sent") + ": "
                            + saved.getQuotedPrice() + " x " + saved.getQuantity());
            if (saved.getStatus() == QuoteStatus.SENT) {
                notificationDispatcher.dispatch(saved.getBuyerId(), NotificationType.QUOTE_RECEIVED,
                        "New quote", "You received a quote of " + saved.getQuotedPrice() + " per unit", link);
            }
        }

        log.info("Quote {} created as {} in conversation {} by {} {}",
                saved.getId(), saved.getStatus(), conversation.getId(), actorRole, actorId);
        return saved;
    }

    /**
     * Reads a quote. An open quote past its expiry is persisted as EXPIRED first.
     */
    public Quote getQuote(UUID quoteId, Long actorId, ActorRole actorRole) {
        workflowEngine.expireIfDue(EntityType.QUOTE, quoteId);
        Quote quote = quoteRepository.findById(quoteId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.QUOTE, quoteId));
        ActorAccess.requireParty(EntityType.QUOTE, quoteId, quote.getBuyerId(), quote.getSellerId(),
                actorId, actorRole, "read");
        return quote;
    }

    public List<Quote> listQuotes(UUID conversationId, Long actorId, ActorRole actorRole) {
        conversationService.getConversation(conversationId, actorId, actorRole);

        LocalDateTime now = LocalDateTime.now();
        for (Quote quote : quoteRepository.findByConversationIdOrderByCreatedAtAsc(conversationId)) {
            if (OPEN.contains(quote.getStatus()) && quote.isExpiredAt(now)) {
                workflowEngine.expireIfDue(EntityType.QUOTE, quote.getId());
            }
        }
        return quoteRepository.findByConversationIdOrderByCreatedAtAsc(conversationId);
    }
}

package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.DesignApprovalStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.error.ConversationClosedException;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.mapper.CommerceMapper;
import com.nosota.tradeflow.model.Conversation;
import com.nosota.tradeflow.model.DesignApproval;
import com.nosota.tradeflow.model.Quote;
import com.nosota.tradeflow.repository.DesignApprovalRepository;
import com.nosota.tradeflow.repository.QuoteRepository;
import com.nosota.tradeflow.service.ConversationService;
import com.nosota.tradeflow.service.QuoteSupersession;
import com.nosota.tradeflow.statemachine.TransitionTable;
import com.nosota.tradeflow.statemachine.TransitionTables;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

/**
 * Quote moves.
 *
 * <p>Expiry is lazy: an open quote past its {@code expiresAt} reports EXPIRE as its due
 * system move, which the engine applies before any read or action on it.
 */
@Component
public class QuoteWorkflowHandler extends AbstractWorkflowHandler<Quote, QuoteStatus> {

    private static final EnumSet<QuoteStatus> OPEN = EnumSet.of(QuoteStatus.PENDING, QuoteStatus.SENT);
    private static final EnumSet<DesignApprovalStatus> ACCEPTABLE_DESIGN =
            EnumSet.of(DesignApprovalStatus.APPROVED, DesignApprovalStatus.RESUBMITTED);

    private final QuoteRepository quoteRepository;
    private final DesignApprovalRepository designApprovalRepository;
    private final ConversationService conversationService;
    private final QuoteSupersession quoteSupersession;
    private final int defaultValidityDays;

    public QuoteWorkflowHandler(SideEffectFactory sideEffects, QuoteRepository quoteRepository,
                                DesignApprovalRepository designApprovalRepository,
                                ConversationService conversationService, QuoteSupersession quoteSupersession,
                                @Value("${workflow.quote.default-validity-days:7}") int defaultValidityDays) {
        super(sideEffects);
        this.quoteRepository = quoteRepository;
        this.designApprovalRepository = designApprovalRepository;
        this.conversationService = conversationService;
        this.quoteSupersession = quoteSupersession;
        this.defaultValidityDays = defaultValidityDays;
    }

    @Override
    public EntityType entityType() {
        return EntityType.QUOTE;
    }

    @Override
    public TransitionTable<QuoteStatus> table() {
        return TransitionTables.QUOTE;
    }

    @Override
    public Quote load(UUID id) {
        return quoteRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.QUOTE, id));
    }

    @Override
    public QuoteStatus statusOf(Quote quote) {
        return quote.getStatus();
    }

    @Override
    public void setStatus(Quote quote, QuoteStatus status) {
        quote.setStatus(status);
    }

    @Override
    public Long buyerOf(Quote quote) {
        return quote.getBuyerId();
    }

    @Override
    public Long sellerOf(Quote quote) {
        return quote.getSellerId();
    }

    @Override
    public UUID conversationOf(Quote quote) {
        return quote.getConversationId();
    }

    @Override
    protected String linkOf(Quote quote) {
        return "/quotes/" + quote.getId();
    }

    @Override
    public Optional<WorkflowAction> dueSystemAction(Quote quote) {
        if (OPEN.contains(quote.getStatus()) && quote.isExpiredAt(LocalDateTime.now())) {
            return Optional.of(WorkflowAction.EXPIRE);
        }
        return Optional.empty();
    }

    @Override
    public void onTransition(Quote quote, TransitionContext ctx) {
        TransitionPayload payload = ctx.getPayload();
        LocalDateTime now = LocalDateTime.now();

        switch (ctx.getAction()) {
            case SEND -> {
                Conversation conversation = conversationService.lock(quote.getConversationId());
                if (conversation.isClosed()) {
                    throw new ConversationClosedException(conversation.getId(), conversation.getStatus());
                }
                if (payload.quotedPrice() != null) {
                    quote.setQuotedPrice(payload.quotedPrice());
                }
                if (quote.getQuotedPrice() == null || quote.getQuotedPrice().signum() <= 0) {
                    throw guardFailed(quote, ctx, "a positive quoted price is required");
                }
                if (payload.expiresAt() != null) {
                    if (!payload.expiresAt().isAfter(now)) {
                        throw guardFailed(quote, ctx, "expiry must be in the future");
                    }
                    quote.setExpiresAt(payload.expiresAt());
                } else if (quote.getExpiresAt() == null || !quote.getExpiresAt().isAfter(now)) {
                    quote.setExpiresAt(now.plusDays(defaultValidityDays));
                }
                quoteSupersession.supersedeOthers(quote.getConversationId(), quote.getId()).forEach(ctx::record);
                announce(quote, ctx, "Quote sent: " + quote.getQuotedPrice() + " x " + quote.getQuantity(),
                        NotificationType.QUOTE_RECEIVED, "New quote",
                        "You received a quote of " + quote.getQuotedPrice() + " per unit");
            }
            case ACCEPT -> {
                if (quote.isExpiredAt(now)) {
                    throw guardFailed(quote, ctx, "the quote expired at " + quote.getExpiresAt());
                }
                if (quote.getDesignApprovalId() != null) {
                    DesignApproval design = designApprovalRepository.findById(quote.getDesignApprovalId())
                            .orElseThrow(() -> new EntityNotFoundException(EntityType.DESIGN_APPROVAL,
                                    quote.getDesignApprovalId()));
                    if (!ACCEPTABLE_DESIGN.contains(design.getStatus())) {
                        throw guardFailed(quote, ctx, "linked design approval is " + design.getStatus());
                    }
                }
                quote.setAcceptedAt(now);
                announce(quote, ctx, "Quote accepted", NotificationType.QUOTE_ACCEPTED,
                        "Quote accepted", "Your quote was accepted");
            }
            case REJECT -> {
                quote.setRejectionReason(ctx.notes());
                String reason = isBlank(ctx.notes()) ? "" : ": " + ctx.notes();
                announce(quote, ctx, "Quote rejected" + reason, NotificationType.QUOTE_REJECTED,
                        "Quote rejected", "The quote was rejected" + reason);
            }
            case EXPIRE -> announce(quote, ctx, "Quote expired", NotificationType.QUOTE_EXPIRED,
                    "Quote expired", "The quote expired before it was accepted");
            case SUPERSEDE -> notifyParty(quote, ctx, quote.getBuyerId(), NotificationType.QUOTE_SUPERSEDED,
                    "Quote replaced", "A newer quote replaced this offer");
            default -> throw guardFailed(quote, ctx, "no quote behaviour for " + ctx.getAction());
        }
    }

    @Override
    public Quote save(Quote quote) {
        return quoteRepository.saveAndFlush(quote);
    }

    @Override
    public Long versionOf(Quote quote) {
        return quote.getVersion();
    }

    @Override
    public Object toResponse(Quote quote) {
        return CommerceMapper.INSTANCE.toResponse(quote);
    }
}

package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.DesignApprovalStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.mapper.CommerceMapper;
import com.nosota.tradeflow.model.DesignApproval;
import com.nosota.tradeflow.model.Quote;
import com.nosota.tradeflow.repository.DesignApprovalRepository;
import com.nosota.tradeflow.repository.QuoteRepository;
import com.nosota.tradeflow.statemachine.TransitionTable;
import com.nosota.tradeflow.statemachine.TransitionTables;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.UUID;

@Component
public class DesignApprovalWorkflowHandler extends AbstractWorkflowHandler<DesignApproval, DesignApprovalStatus> {

    private final DesignApprovalRepository designApprovalRepository;
    private final QuoteRepository quoteRepository;

    public DesignApprovalWorkflowHandler(SideEffectFactory sideEffects,
                                         DesignApprovalRepository designApprovalRepository,
                                         QuoteRepository quoteRepository) {
        super(sideEffects);
        this.designApprovalRepository = designApprovalRepository;
        this.quoteRepository = quoteRepository;
    }

    @Override
    public EntityType entityType() {
        return EntityType.DESIGN_APPROVAL;
    }

    @Override
    public TransitionTable<DesignApprovalStatus> table() {
        return TransitionTables.DESIGN_APPROVAL;
    }

    @Override
    public DesignApproval load(UUID id) {
        return designApprovalRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.DESIGN_APPROVAL, id));
    }

    @Override
    public DesignApprovalStatus statusOf(DesignApproval design) {
        return design.getStatus();
    }

    @Override
    public void setStatus(DesignApproval design, DesignApprovalStatus status) {
        design.setStatus(status);
    }

    @Override
    public Long buyerOf(DesignApproval design) {
        return design.getBuyerId();
    }

    @Override
    public Long sellerOf(DesignApproval design) {
        return design.getSellerId();
    }

    @Override
    public UUID conversationOf(DesignApproval design) {
        return design.getConversationId();
    }

    @Override
    protected String linkOf(DesignApproval design) {
        return "/conversations/" + design.getConversationId() + "/designs/" + design.getId();
    }

    @Override
    public void onTransition(DesignApproval design, TransitionContext ctx) {
        LocalDateTime now = LocalDateTime.now();

        switch (ctx.getAction()) {
            case APPROVE -> {
                if (design.getQuoteId() != null) {
                    Quote quote = quoteRepository.findById(design.getQuoteId())
                            .orElseThrow(() -> new EntityNotFoundException(EntityType.QUOTE, design.getQuoteId()));
                    if (quote.getStatus() != QuoteStatus.ACCEPTED) {
                        throw guardFailed(design, ctx, "linked quote is " + quote.getStatus() + ", not ACCEPTED");
                    }
                }
                design.setSellerNotes(ctx.notes());
                design.setReviewedAt(now);
                design.setApprovedAt(now);
                announce(design, ctx, "Design approved", NotificationType.DESIGN_APPROVED,
                        "Design approved", "The seller approved your design");
            }
            case REJECT -> {
                design.setSellerNotes(ctx.notes());
                design.setReviewedAt(now);
                String reason = isBlank(ctx.notes()) ? "" : ": " + ctx.notes();
                announce(design, ctx, "Design rejected" + reason, NotificationType.DESIGN_REJECTED,
                        "Design rejected", "The seller rejected your design" + reason);
            }
            case REQUEST_CHANGES -> {
                if (isBlank(ctx.notes())) {
                    throw guardFailed(design, ctx, "notes describing the requested changes are required");
                }
                design.setSellerNotes(ctx.notes());
                design.setReviewedAt(now);
                announce(design, ctx, "Changes requested: " + ctx.notes(), NotificationType.DESIGN_CHANGES_REQUESTED,
                        "Design changes requested", ctx.notes());
            }
            case RESUBMIT -> {
                if (ctx.getPayload().designFiles() == null || ctx.getPayload().designFiles().isEmpty()) {
                    throw guardFailed(design, ctx, "at least one design file is required");
                }
                design.getDesignFiles().clear();
                design.getDesignFiles().addAll(CommerceMapper.INSTANCE.toDesignFiles(ctx.getPayload().designFiles()));
                if (!isBlank(ctx.notes())) {
                    design.setBuyerNotes(ctx.notes());
                }
                announce(design, ctx, "Design resubmitted with " + design.getDesignFiles().size() + " file(s)",
                        NotificationType.DESIGN_RESUBMITTED, "Design resubmitted",
                        "The buyer uploaded a revised design");
            }
            case SUPERSEDE -> {
                // Replaced by a newer submission, which announces itself.
            }
            default -> throw guardFailed(design, ctx, "no design approval behaviour for " + ctx.getAction());
        }
    }

    @Override
    public DesignApproval save(DesignApproval design) {
        return designApprovalRepository.saveAndFlush(design);
    }

    @Override
    public Long versionOf(DesignApproval design) {
        return design.getVersion();
    }

    @Override
    public Object toResponse(DesignApproval design) {
        return CommerceMapper.INSTANCE.toResponse(design);
    }
}

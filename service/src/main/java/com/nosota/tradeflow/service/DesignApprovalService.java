package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.DesignApprovalStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.CreateDesignApprovalRequest;
import com.nosota.tradeflow.error.ConversationClosedException;
import com.nosota.tradeflow.error.DuplicateActiveResourceException;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.mapper.CommerceMapper;
import com.nosota.tradeflow.model.Conversation;
import com.nosota.tradeflow.model.DesignApproval;
import com.nosota.tradeflow.repository.DesignApprovalRepository;
import com.nosota.tradeflow.statemachine.TransitionTables;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class DesignApprovalService {

    /** Statuses of the latest submission that allow the buyer to submit a new design. */
    private static final EnumSet<DesignApprovalStatus> REPLACEABLE = EnumSet.of(
            DesignApprovalStatus.CHANGES_REQUESTED, DesignApprovalStatus.REJECTED, DesignApprovalStatus.SUPERSEDED);

    private final DesignApprovalRepository designApprovalRepository;
    private final ConversationService conversationService;
    private final NotificationDispatcher notificationDispatcher;

    /**
     * Submits a design for the seller's sign-off.
     *
     * <p>Allowed when the item has no submission yet, or its latest one had changes requested,
     * was rejected or was superseded. Earlier submissions waiting for changes are superseded by
     * the new one.
     *
     * @throws DuplicateActiveResourceException if a submission for the item is still pending a decision
     */
    @Transactional
    public DesignApproval createDesignApproval(Long actorId, ActorRole actorRole, CreateDesignApprovalRequest request) {
        ActorAccess.requireRole(EntityType.DESIGN_APPROVAL, null, actorId, actorRole, ActorRole.BUYER, "submit");
        Conversation conversation = conversationService.lock(request.conversationId());
        conversationService.requireAccess(conversation, actorId, actorRole);
        if (conversation.isClosed()) {
            throw new ConversationClosedException(conversation.getId(), conversation.getStatus());
        }
        if ((request.productId() == null) == (request.serviceId() == null)) {
            throw new IllegalArgumentException("A design approval covers exactly one of productId or serviceId");
        }

        List<DesignApproval> previous = designApprovalRepository.findForItem(conversation.getId(),
                request.productId(), request.serviceId());
        if (!previous.isEmpty() && !REPLACEABLE.contains(previous.get(0).getStatus())) {
            DesignApproval latest = previous.get(0);
            log.warn("Design submission refused in conversation {}: {} is still {}",
                    conversation.getId(), latest.getId(), latest.getStatus());
            throw new DuplicateActiveResourceException("design approval", conversation.getId(), latest.getId());
        }

        for (DesignApproval earlier : previous) {
            if (earlier.getStatus() == DesignApprovalStatus.CHANGES_REQUESTED) {
                earlier.setStatus(TransitionTables.DESIGN_APPROVAL
                        .resolve(earlier.getId(), earlier.getStatus(), WorkflowAction.SUPERSEDE, ActorRole.SYSTEM)
                        .to());
                designApprovalRepository.save(earlier);
                log.info("Design approval {} superseded by a new submission", earlier.getId());
            }
        }

        DesignApproval design = new DesignApproval();
        design.setConversationId(conversation.getId());
        design.setBuyerId(conversation.getBuyerId());
        design.setSellerId(conversation.getSellerId());
        design.setProductId(request.productId());
        design.setServiceId(request.serviceId());
        design.setVariantId(request.variantId());
        design.setPackageId(request.packageId());
        design.setQuoteId(request.quoteId());
        design.setDesignFiles(new ArrayList<>(CommerceMapper.INSTANCE.toDesignFiles(request.designFiles())));
        design.setBuyerNotes(request.buyerNotes());
        design.setStatus(DesignApprovalStatus.PENDING);

        DesignApproval saved = designApprovalRepository.saveAndFlush(design);
        conversationService.postSystemMessage(conversation.getId(),
                "Design submitted with " + saved.getDesignFiles().size() + " file(s)");
        notificationDispatcher.dispatch(saved.getSellerId(), NotificationType.DESIGN_SUBMITTED,
                "Design submitted", "A buyer submitted a design for your approval",
                "/conversations/" + conversation.getId() + "/designs/" + saved.getId());

        log.info("Design approval {} submitted in conversation {} by buyer {}", saved.getId(), conversation.getId(), actorId);
        return saved;
    }

    public DesignApproval getDesignApproval(UUID designApprovalId, Long actorId, ActorRole actorRole) {
        DesignApproval design = designApprovalRepository.findById(designApprovalId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.DESIGN_APPROVAL, designApprovalId));
        ActorAccess.requireParty(EntityType.DESIGN_APPROVAL, designApprovalId, design.getBuyerId(),
                design.getSellerId(), actorId, actorRole, "read");
        return design;
    }

    public List<DesignApproval> listDesignApprovals(UUID conversationId, Long actorId, ActorRole actorRole) {
        conversationService.getConversation(conversationId, actorId, actorRole);
        return designApprovalRepository.findByConversationIdOrderByCreatedAtAsc(conversationId);
    }
}

package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.request.CreateDesignApprovalRequest;
import com.nosota.tradeflow.api.request.CreateQuoteRequest;
import com.nosota.tradeflow.api.response.DesignApprovalResponse;
import com.nosota.tradeflow.api.response.QuoteResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Negotiation API: custom quotes and design approvals exchanged inside a conversation.
 *
 * <p>Creation and reads live here; every status change (send, accept, reject, approve,
 * request changes, resubmit) goes through {@link WorkflowApi}.
 *
 * <p>Implemented by NegotiationController (service) and NegotiationClient (api).
 */
@RequestMapping("/api/v1/negotiation")
public interface NegotiationApi {

    // ==================== Quotes ====================

    /**
     * Creates a quote. A seller's quote supersedes the conversation's other pending or sent
     * quotes; a buyer's quote is a request the seller prices later.
     */
    @PostMapping("/quotes")
    ResponseEntity<QuoteResponse> createQuote(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid CreateQuoteRequest request);

    /**
     * Reads a quote. A quote past its expiry is persisted as EXPIRED before it is returned.
     */
    @GetMapping("/quotes/{quoteId}")
    ResponseEntity<QuoteResponse> getQuote(
            @PathVariable("quoteId") UUID quoteId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    @GetMapping("/conversations/{conversationId}/quotes")
    ResponseEntity<List<QuoteResponse>> listQuotes(
            @PathVariable("conversationId") UUID conversationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    // ==================== Design approvals ====================

    /**
     * Submits a design for seller sign-off. Allowed only when the latest submission for the
     * same item asked for changes or was rejected.
     */
    @PostMapping("/design-approvals")
    ResponseEntity<DesignApprovalResponse> createDesignApproval(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid CreateDesignApprovalRequest request);

    @GetMapping("/design-approvals/{designApprovalId}")
    ResponseEntity<DesignApprovalResponse> getDesignApproval(
            @PathVariable("designApprovalId") UUID designApprovalId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    @GetMapping("/conversations/{conversationId}/design-approvals")
    ResponseEntity<List<DesignApprovalResponse>> listDesignApprovals(
            @PathVariable("conversationId") UUID conversationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);
}

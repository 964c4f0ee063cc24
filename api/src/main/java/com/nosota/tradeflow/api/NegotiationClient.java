package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.request.CreateDesignApprovalRequest;
import com.nosota.tradeflow.api.request.CreateQuoteRequest;
import com.nosota.tradeflow.api.response.DesignApprovalResponse;
import com.nosota.tradeflow.api.response.QuoteResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of NegotiationApi.
 */
@RequiredArgsConstructor
@Slf4j
public class NegotiationClient implements NegotiationApi {

    private final WebClient webClient;

    // ==================== Quotes ====================

    @Override
    public ResponseEntity<QuoteResponse> createQuote(Long actorId, ActorRole actorRole, CreateQuoteRequest request) {
        log.debug("Calling createQuote: conversationId={}, actorRole={}", request.conversationId(), actorRole);

        return webClient.post()
                .uri("/api/v1/negotiation/quotes")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(QuoteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<QuoteResponse> getQuote(UUID quoteId, Long actorId, ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/negotiation/quotes/{quoteId}", quoteId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(QuoteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<QuoteResponse>> listQuotes(UUID conversationId, Long actorId, ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/negotiation/conversations/{conversationId}/quotes", conversationId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<QuoteResponse>>() {})
                .block();
    }

    // ==================== Design approvals ====================

    @Override
    public ResponseEntity<DesignApprovalResponse> createDesignApproval(Long actorId, ActorRole actorRole,
                                                                       CreateDesignApprovalRequest request) {
        log.debug("Calling createDesignApproval: conversationId={}, files={}",
                request.conversationId(), request.designFiles().size());

        return webClient.post()
                .uri("/api/v1/negotiation/design-approvals")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(DesignApprovalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DesignApprovalResponse> getDesignApproval(UUID designApprovalId, Long actorId,
                                                                    ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/negotiation/design-approvals/{designApprovalId}", designApprovalId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(DesignApprovalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<DesignApprovalResponse>> listDesignApprovals(UUID conversationId, Long actorId,
                                                                            ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/negotiation/conversations/{conversationId}/design-approvals", conversationId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<DesignApprovalResponse>>() {})
                .block();
    }
}

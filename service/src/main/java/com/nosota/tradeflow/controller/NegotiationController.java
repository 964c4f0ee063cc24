package com.nosota.tradeflow.controller;

import com.nosota.tradeflow.api.NegotiationApi;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.request.CreateDesignApprovalRequest;
import com.nosota.tradeflow.api.request.CreateQuoteRequest;
import com.nosota.tradeflow.api.response.DesignApprovalResponse;
import com.nosota.tradeflow.api.response.QuoteResponse;
import com.nosota.tradeflow.mapper.CommerceMapper;
import com.nosota.tradeflow.service.DesignApprovalService;
import com.nosota.tradeflow.service.QuoteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class NegotiationController implements NegotiationApi {

    private static final CommerceMapper MAPPER = CommerceMapper.INSTANCE;

    private final QuoteService quoteService;
    private final DesignApprovalService designApprovalService;

    @Override
    public ResponseEntity<QuoteResponse> createQuote(Long actorId, ActorRole actorRole, CreateQuoteRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MAPPER.toResponse(
                quoteService.createQuote(actorId, ExternalActor.require(actorRole), request)));
    }

    @Override
    public ResponseEntity<QuoteResponse> getQuote(UUID quoteId, Long actorId, ActorRole actorRole) {
        return ResponseEntity.ok(MAPPER.toResponse(
                quoteService.getQuote(quoteId, actorId, ExternalActor.require(actorRole))));
    }

    @Override
    public ResponseEntity<List<QuoteResponse>> listQuotes(UUID conversationId, Long actorId, ActorRole actorRole) {
        return ResponseEntity.ok(MAPPER.toQuoteResponseList(
                quoteService.listQuotes(conversationId, actorId, ExternalActor.require(actorRole))));
    }

    @Override
    public ResponseEntity<DesignApprovalResponse> createDesignApproval(Long actorId, ActorRole actorRole,
                                                                       CreateDesignApprovalRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MAPPER.toResponse(
                designApprovalService.createDesignApproval(actorId, ExternalActor.require(actorRole), request)));
    }

    @Override
    public ResponseEntity<DesignApprovalResponse> getDesignApproval(UUID designApprovalId, Long actorId,
                                                                    ActorRole actorRole) {
        return ResponseEntity.ok(MAPPER.toResponse(
                designApprovalService.getDesignApproval(designApprovalId, actorId, ExternalActor.require(actorRole))));
    }

    @Override
    public ResponseEntity<List<DesignApprovalResponse>> listDesignApprovals(UUID conversationId, Long actorId,
                                                                            ActorRole actorRole) {
        return ResponseEntity.ok(MAPPER.toDesignApprovalResponseList(
                designApprovalService.listDesignApprovals(conversationId, actorId, ExternalActor.require(actorRole))));
    }
}

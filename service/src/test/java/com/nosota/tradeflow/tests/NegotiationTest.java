package com.nosota.tradeflow.tests;

import com.nosota.tradeflow.TestBase;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.ConversationType;
import com.nosota.tradeflow.api.model.DesignApprovalStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.CreateConversationRequest;
import com.nosota.tradeflow.api.request.CreateDesignApprovalRequest;
import com.nosota.tradeflow.api.request.CreateOrderRequest;
import com.nosota.tradeflow.api.request.CreateQuoteRequest;
import com.nosota.tradeflow.api.request.DesignFilePayload;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.error.DuplicateActiveResourceException;
import com.nosota.tradeflow.error.InvalidTransitionException;
import com.nosota.tradeflow.model.DesignApproval;
import com.nosota.tradeflow.model.Order;
import com.nosota.tradeflow.model.Quote;
import com.nosota.tradeflow.repository.QuoteRepository;
import com.nosota.tradeflow.workflow.SideEffect;
import com.nosota.tradeflow.workflow.TransitionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Quotes and design approvals negotiated inside a product conversation, up to the order placed
 * from the agreed quote.
 */
public class NegotiationTest extends TestBase {

    @Autowired
    private QuoteRepository quoteRepository;

    private Long buyerId;
    private Long sellerId;
    private UUID productId;
    private UUID conversationId;

    @BeforeEach
    public void openConversation() {
        buyerId = newUserId();
        sellerId = newUserId();
        productId = UUID.randomUUID();
        conversationId = conversationService.createConversation(buyerId, ActorRole.BUYER,
                new CreateConversationRequest(ConversationType.PRE_PURCHASE_PRODUCT, "Custom mugs", buyerId,
                        sellerId, productId, null, null, null)).getId();
    }

    @Test
    public void requestedQuote_isPricedBySeller() {
        Quote requested = quoteService.createQuote(buyerId, ActorRole.BUYER, quoteRequest(null, null));
        assertThat(requested.getStatus()).isEqualTo(QuoteStatus.REQUESTED);
        assertThat(notificationTypesOf(sellerId)).contains(NotificationType.QUOTE_REQUESTED);

        TransitionResult sent = workflowEngine.applyTransition(EntityType.QUOTE, requested.getId(), WorkflowAction.SEND,
                sellerId, ActorRole.SELLER,
                new TransitionPayload(null, null, new BigDecimal("12.50"), null, null, null, null, null, null));

        assertThat(sent.status()).isEqualTo(QuoteStatus.SENT.name());
        Quote priced = quoteService.getQuote(requested.getId(), buyerId, ActorRole.BUYER);
        assertThat(priced.getQuotedPrice()).isEqualByComparingTo("12.50");
        assertThat(notificationTypesOf(buyerId)).contains(NotificationType.QUOTE_RECEIVED);
    }

    @Test
    public void buyerCannotPriceAQuote() {
        Quote requested = quoteService.createQuote(buyerId, ActorRole.BUYER, quoteRequest(null, null));

        assertThatThrownBy(() -> workflowEngine.applyTransition(EntityType.QUOTE, requested.getId(),
                WorkflowAction.SEND, buyerId, ActorRole.BUYER,
                new TransitionPayload(null, null, new BigDecimal("1.00"), null, null, null, null, null, null)))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    public void newQuoteSupersedesOpenOne() {
        Quote first = quoteService.createQuote(sellerId, ActorRole.SELLER, quoteRequest(new BigDecimal("15.00"), null));
        Quote second = quoteService.createQuote(sellerId, ActorRole.SELLER, quoteRequest(new BigDecimal("14.00"), null));

        assertThat(quoteService.getQuote(first.getId(), buyerId, ActorRole.BUYER).getStatus())
                .isEqualTo(QuoteStatus.SUPERSEDED);
        assertThat(second.getStatus()).isEqualTo(QuoteStatus.SENT);
        assertThat(notificationTypesOf(buyerId)).contains(NotificationType.QUOTE_SUPERSEDED);

        assertThatThrownBy(() -> workflowEngine.applyTransition(EntityType.QUOTE, first.getId(),
                WorkflowAction.ACCEPT, buyerId, ActorRole.BUYER, null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    public void sendingDraftSupersedesOtherOpenQuotes() {
        Quote sent = quoteService.createQuote(sellerId, ActorRole.SELLER, quoteRequest(new BigDecimal("15.00"), null));
        Quote draft = quoteService.createQuote(sellerId, ActorRole.SELLER,
                new CreateQuoteRequest(conversationId, productId, null, null, null, new BigDecimal("13.00"), 100,
                        null, null, null, true));
        assertThat(draft.getStatus()).isEqualTo(QuoteStatus.PENDING);

        TransitionResult result = workflowEngine.applyTransition(EntityType.QUOTE, draft.getId(), WorkflowAction.SEND,
                sellerId, ActorRole.SELLER, null);

        assertThat(result.status()).isEqualTo(QuoteStatus.SENT.name());
        assertThat(quoteRepository.findById(sent.getId()).orElseThrow().getStatus())
                .isEqualTo(QuoteStatus.SUPERSEDED);
    }

    @Test
    public void expiredQuote_isExpiredLazilyAndCannotBeAccepted() {
        Quote quote = quoteService.createQuote(sellerId, ActorRole.SELLER, quoteRequest(new BigDecimal("15.00"), null));
        Quote stored = quoteRepository.findById(quote.getId()).orElseThrow();
        stored.setExpiresAt(LocalDateTime.now().minusMinutes(1));
        quoteRepository.saveAndFlush(stored);

        assertThatThrownBy(() -> workflowEngine.applyTransition(EntityType.QUOTE, quote.getId(),
                WorkflowAction.ACCEPT, buyerId, ActorRole.BUYER, null))
                .isInstanceOf(InvalidTransitionException.class);

        assertThat(quoteRepository.findById(quote.getId()).orElseThrow().getStatus()).isEqualTo(QuoteStatus.EXPIRED);
        assertThat(notificationTypesOf(buyerId)).contains(NotificationType.QUOTE_EXPIRED);
    }

    @Test
    public void quoteWithPastExpiryIsRefused() {
        assertThatThrownBy(() -> quoteService.createQuote(sellerId, ActorRole.SELLER,
                quoteRequest(new BigDecimal("15.00"), LocalDateTime.now().minusDays(1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void designChangesThenApproval() {
        DesignApproval design = designApprovalService.createDesignApproval(buyerId, ActorRole.BUYER, designRequest());
        assertThat(design.getStatus()).isEqualTo(DesignApprovalStatus.PENDING);

        assertThatThrownBy(() -> designApprovalService.createDesignApproval(buyerId, ActorRole.BUYER, designRequest()))
                .isInstanceOf(DuplicateActiveResourceException.class);

        workflowEngine.applyTransition(EntityType.DESIGN_APPROVAL, design.getId(), WorkflowAction.REQUEST_CHANGES,
                sellerId, ActorRole.SELLER, TransitionPayload.withNotes("Logo must be vector"));
        workflowEngine.applyTransition(EntityType.DESIGN_APPROVAL, design.getId(), WorkflowAction.RESUBMIT,
                buyerId, ActorRole.BUYER, new TransitionPayload(null, null, null, null, null, null, null, null,
                        List.of(new DesignFilePayload("https://files.test/logo.svg", "logo.svg", 2048L, "image/svg+xml"))));
        TransitionResult approved = workflowEngine.applyTransition(EntityType.DESIGN_APPROVAL, design.getId(),
                WorkflowAction.APPROVE, sellerId, ActorRole.SELLER, null);

        assertThat(approved.status()).isEqualTo(DesignApprovalStatus.APPROVED.name());
        DesignApproval stored = designApprovalService.getDesignApproval(design.getId(), buyerId, ActorRole.BUYER);
        assertThat(stored.getDesignFiles()).extracting(f -> f.getFilename()).containsExactly("logo.svg");
        assertThat(notificationTypesOf(buyerId))
                .contains(NotificationType.DESIGN_CHANGES_REQUESTED, NotificationType.DESIGN_APPROVED);
        assertThat(notificationTypesOf(sellerId)).contains(NotificationType.DESIGN_RESUBMITTED);
    }

    @Test
    public void newSubmissionSupersedesChangesRequested() {
        DesignApproval first = designApprovalService.createDesignApproval(buyerId, ActorRole.BUYER, designRequest());
        workflowEngine.applyTransition(EntityType.DESIGN_APPROVAL, first.getId(), WorkflowAction.REQUEST_CHANGES,
                sellerId, ActorRole.SELLER, TransitionPayload.withNotes("Too dark"));

        DesignApproval second = designApprovalService.createDesignApproval(buyerId, ActorRole.BUYER, designRequest());

        assertThat(designApprovalService.listDesignApprovals(conversationId, buyerId, ActorRole.BUYER))
                .extracting(DesignApproval::getId, DesignApproval::getStatus)
                .contains(
                        tuple(first.getId(), DesignApprovalStatus.SUPERSEDED),
                        tuple(second.getId(), DesignApprovalStatus.PENDING));
    }

    @Test
    public void acceptedQuote_drivesOrderTerms() {
        Quote quote = quoteService.createQuote(sellerId, ActorRole.SELLER, quoteRequest(new BigDecimal("9.00"), null));
        TransitionResult accepted = workflowEngine.applyTransition(EntityType.QUOTE, quote.getId(),
                WorkflowAction.ACCEPT, buyerId, ActorRole.BUYER, null);
        assertThat(accepted.status()).isEqualTo(QuoteStatus.ACCEPTED.name());
        assertThat(accepted.sideEffects()).extracting(SideEffect::type).contains(SideEffectType.SYSTEM_MESSAGE_POSTED);

        Order order = orderService.createOrder(buyerId, ActorRole.BUYER, new CreateOrderRequest(productId, null,
                sellerId, 1, new BigDecimal("999.00"), BigDecimal.ZERO, "2 Side Street", PaymentMethod.BANK_TRANSFER,
                conversationId, quote.getId(), null));

        assertThat(order.getQuoteId()).isEqualTo(quote.getId());
        assertThat(order.getQuantity()).isEqualTo(100);
        assertThat(order.getUnitPrice()).isEqualByComparingTo("9.00");
        assertThat(order.getTotalAmount()).isEqualByComparingTo("900.00");
    }

    @Test
    public void orderFromUnacceptedQuoteIsRefused() {
        Quote quote = quoteService.createQuote(sellerId, ActorRole.SELLER, quoteRequest(new BigDecimal("9.00"), null));

        assertThatThrownBy(() -> orderService.createOrder(buyerId, ActorRole.BUYER, new CreateOrderRequest(productId,
                null, sellerId, 1, new BigDecimal("9.00"), null, "2 Side Street", PaymentMethod.BANK_TRANSFER,
                conversationId, quote.getId(), null)))
                .isInstanceOf(IllegalStateException.class);
    }

    private CreateQuoteRequest quoteRequest(BigDecimal price, LocalDateTime expiresAt) {
        return new CreateQuoteRequest(conversationId, productId, null, null, null, price, 100,
                "Two-colour print", expiresAt, null, false);
    }

    private CreateDesignApprovalRequest designRequest() {
        return new CreateDesignApprovalRequest(conversationId, productId, null, null, null, null,
                List.of(new DesignFilePayload("https://files.test/logo.png", "logo.png", 1024L, "image/png")),
                "Print on both sides");
    }
}

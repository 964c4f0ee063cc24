package com.nosota.tradeflow.tests;

import com.nosota.tradeflow.TestBase;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.ConversationStatus;
import com.nosota.tradeflow.api.model.ConversationType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.request.AppendMessageRequest;
import com.nosota.tradeflow.api.request.AttachmentPayload;
import com.nosota.tradeflow.api.request.CreateConversationRequest;
import com.nosota.tradeflow.api.response.AttachmentResponse;
import com.nosota.tradeflow.api.response.MessageResponse;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.error.ConversationClosedException;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.error.InvalidTransitionException;
import com.nosota.tradeflow.model.Conversation;
import com.nosota.tradeflow.model.Order;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

public class ConversationTest extends TestBase {

    private Long buyerId;
    private Long sellerId;
    private UUID productId;

    @BeforeEach
    public void setupParties() {
        buyerId = newUserId();
        sellerId = newUserId();
        productId = UUID.randomUUID();
    }

    @Test
    public void prePurchaseConversation_isReusedWhileActive() {
        Conversation first = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry());
        Conversation second = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry());

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(first.getStatus()).isEqualTo(ConversationStatus.ACTIVE);
    }

    @Test
    public void concurrentInquiries_shareOneConversation() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            CompletableFuture<Conversation> first = openAfter(start, pool);
            CompletableFuture<Conversation> second = openAfter(start, pool);
            start.countDown();

            UUID firstId = first.get(30, TimeUnit.SECONDS).getId();
            assertThat(second.get(30, TimeUnit.SECONDS).getId()).isEqualTo(firstId);
        } finally {
            pool.shutdown();
        }
    }

    @Test
    public void orderConversation_isOnlyHandedToOrderParties() {
        Order order = placeOrder(buyerId, sellerId);
        Long stranger = newUserId();

        assertThatThrownBy(() -> conversationService.createConversation(stranger, ActorRole.BUYER,
                orderThread(stranger, order.getId())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> conversationService.createConversation(stranger, ActorRole.BUYER,
                orderThread(stranger, UUID.randomUUID())))
                .isInstanceOf(EntityNotFoundException.class);

        Conversation own = conversationService.createConversation(buyerId, ActorRole.BUYER,
                orderThread(buyerId, order.getId()));
        assertThat(own.getId()).isEqualTo(order.getConversationId());
    }

    @Test
    public void productInquiryWithoutProductIsRejected() {
        CreateConversationRequest request = new CreateConversationRequest(ConversationType.PRE_PURCHASE_PRODUCT,
                "Sizes?", buyerId, sellerId, null, null, null, null);

        assertThatThrownBy(() -> conversationService.createConversation(buyerId, ActorRole.BUYER, request))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void buyerCannotOpenConversationForSomeoneElse() {
        assertThatThrownBy(() -> conversationService.createConversation(newUserId(), ActorRole.BUYER, productInquiry()))
                .isInstanceOf(ActorNotAuthorizedException.class);
    }

    @Test
    public void messagesAreNumberedInOrder() {
        UUID id = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry()).getId();

        conversationService.appendMessage(id, buyerId, ActorRole.BUYER, text("Is it in stock?"));
        conversationService.appendMessage(id, sellerId, ActorRole.SELLER, text("Yes, three left"));
        MessageResponse third = conversationService.appendMessage(id, buyerId, ActorRole.BUYER, text("Great"));

        assertThat(third.sequenceNumber()).isEqualTo(3L);
        assertThat(third.readBy()).containsExactly(buyerId);

        List<MessageResponse> afterFirst = conversationService.listMessages(id, sellerId, ActorRole.SELLER, 1L, 50);
        assertThat(afterFirst).extracting(MessageResponse::content).containsExactly("Yes, three left", "Great");
    }

    @Test
    public void attachmentsAreReadBackAsSent() {
        UUID id = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry()).getId();
        List<AttachmentPayload> attachments = List.of(
                new AttachmentPayload("https://files.test/lamp-front.jpg", "lamp-front.jpg", "image/jpeg", 48213L),
                new AttachmentPayload("https://files.test/specs.pdf", "specs.pdf", "application/pdf", 1024L));

        conversationService.appendMessage(id, buyerId, ActorRole.BUYER,
                new AppendMessageRequest("Does it match these specs?", attachments));
        conversationService.appendMessage(id, buyerId, ActorRole.BUYER,
                new AppendMessageRequest(null, List.of(attachments.get(1))));

        List<MessageResponse> history = conversationService.listMessages(id, sellerId, ActorRole.SELLER, 0L, 50);
        assertThat(history).hasSize(2);
        assertThat(history.get(0).content()).isEqualTo("Does it match these specs?");
        assertThat(history.get(0).attachments())
                .extracting(AttachmentResponse::url, AttachmentResponse::fileName, AttachmentResponse::mimeType,
                        AttachmentResponse::size)
                .containsExactly(
                        tuple("https://files.test/lamp-front.jpg", "lamp-front.jpg", "image/jpeg", 48213L),
                        tuple("https://files.test/specs.pdf", "specs.pdf", "application/pdf", 1024L));
        assertThat(history.get(1).content()).isNull();
        assertThat(history.get(1).attachments()).extracting(AttachmentResponse::fileName)
                .containsExactly("specs.pdf");
    }

    @Test
    public void unreadCountFollowsReadMarker() {
        UUID id = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry()).getId();
        conversationService.appendMessage(id, buyerId, ActorRole.BUYER, text("Hello"));
        conversationService.appendMessage(id, buyerId, ActorRole.BUYER, text("Anyone there?"));

        assertThat(conversationService.unreadCount(id, sellerId, ActorRole.SELLER)).isEqualTo(2L);
        assertThat(conversationService.unreadCount(id, buyerId, ActorRole.BUYER)).isZero();
        assertThat(notificationTypesOf(sellerId)).containsOnly(NotificationType.MESSAGE_RECEIVED).hasSize(2);

        conversationService.markRead(id, sellerId, ActorRole.SELLER);
        conversationService.markRead(id, sellerId, ActorRole.SELLER);

        assertThat(conversationService.unreadCount(id, sellerId, ActorRole.SELLER)).isZero();
    }

    @Test
    public void outsiderCannotReadMessages() {
        UUID id = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry()).getId();

        assertThatThrownBy(() -> conversationService.listMessages(id, newUserId(), ActorRole.SELLER, 0L, 10))
                .isInstanceOf(ActorNotAuthorizedException.class);
    }

    @Test
    public void resolutionRequestByParty_keepsConversationActive() {
        UUID id = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry()).getId();

        Conversation requested = conversationService.updateStatus(id, buyerId, ActorRole.BUYER,
                ConversationStatus.RESOLVED);

        assertThat(requested.getStatus()).isEqualTo(ConversationStatus.ACTIVE);
        assertThat(requested.getResolutionRequestedBy()).isEqualTo(buyerId);
        assertThat(notificationTypesOf(sellerId)).contains(NotificationType.CONVERSATION_RESOLUTION_REQUESTED);

        assertThatThrownBy(() -> conversationService.updateStatus(id, sellerId, ActorRole.SELLER,
                ConversationStatus.ARCHIVED))
                .isInstanceOf(ActorNotAuthorizedException.class);
    }

    @Test
    public void resolvedConversation_acceptsOnlyAdminAndSystemMessages() {
        UUID id = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry()).getId();

        conversationService.updateStatus(id, ADMIN_ID, ActorRole.ADMIN, ConversationStatus.RESOLVED);

        assertThatThrownBy(() -> conversationService.appendMessage(id, buyerId, ActorRole.BUYER, text("One more thing")))
                .isInstanceOf(ConversationClosedException.class);
        MessageResponse adminNote = conversationService.appendMessage(id, ADMIN_ID, ActorRole.ADMIN,
                text("Closing this thread"));
        conversationService.postSystemMessage(id, "Archived soon");

        List<MessageResponse> messages = conversationService.listMessages(id, buyerId, ActorRole.BUYER, 0L, 50);
        assertThat(messages).extracting(MessageResponse::sequenceNumber)
                .containsExactly(1L, adminNote.sequenceNumber(), adminNote.sequenceNumber() + 1);
        assertThat(notificationTypesOf(buyerId)).contains(NotificationType.CONVERSATION_STATUS_CHANGED);
    }

    @Test
    public void archivedConversationCannotBeReopened() {
        UUID id = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry()).getId();
        conversationService.updateStatus(id, ADMIN_ID, ActorRole.ADMIN, ConversationStatus.ARCHIVED);

        assertThatThrownBy(() -> conversationService.updateStatus(id, ADMIN_ID, ActorRole.ADMIN,
                ConversationStatus.ACTIVE))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> conversationService.updateStatus(id, ADMIN_ID, ActorRole.ADMIN,
                ConversationStatus.RESOLVED))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    public void archivedConversationStartsFreshThread() {
        Conversation first = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry());
        conversationService.updateStatus(first.getId(), ADMIN_ID, ActorRole.ADMIN, ConversationStatus.ARCHIVED);

        Conversation next = conversationService.createConversation(buyerId, ActorRole.BUYER, productInquiry());

        assertThat(next.getId()).isNotEqualTo(first.getId());
    }

    private CreateConversationRequest productInquiry() {
        return new CreateConversationRequest(ConversationType.PRE_PURCHASE_PRODUCT, "About the lamp", buyerId,
                sellerId, productId, null, null, null);
    }

    private CreateConversationRequest orderThread(Long buyer, UUID orderId) {
        return new CreateConversationRequest(ConversationType.ORDER, "Private order thread", buyer, sellerId,
                null, null, orderId, null);
    }

    private CompletableFuture<Conversation> openAfter(CountDownLatch start, ExecutorService pool) {
        CreateConversationRequest request = productInquiry();
        return CompletableFuture.supplyAsync(() -> {
            try {
                start.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return conversationService.createConversation(buyerId, ActorRole.BUYER, request);
        }, pool);
    }

    private static AppendMessageRequest text(String content) {
        return new AppendMessageRequest(content, null);
    }
}

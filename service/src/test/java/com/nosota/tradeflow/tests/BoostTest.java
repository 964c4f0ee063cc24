package com.nosota.tradeflow.tests;

import com.nosota.tradeflow.TestBase;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.BoostPurchaseStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.model.PaymentOutcome;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.CreateBoostPackageRequest;
import com.nosota.tradeflow.api.request.CreateBoostPurchaseRequest;
import com.nosota.tradeflow.api.request.CreateBoostedItemRequest;
import com.nosota.tradeflow.api.request.PaymentResultRequest;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.error.DuplicateActiveResourceException;
import com.nosota.tradeflow.error.InvalidTransitionException;
import com.nosota.tradeflow.model.BoostPackage;
import com.nosota.tradeflow.model.BoostPurchase;
import com.nosota.tradeflow.model.BoostedItem;
import com.nosota.tradeflow.repository.BoostedItemRepository;
import com.nosota.tradeflow.workflow.SideEffect;
import com.nosota.tradeflow.workflow.TransitionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BoostTest extends TestBase {

    @Autowired
    private BoostedItemRepository boostedItemRepository;

    private Long sellerId;
    private UUID itemId;
    private BoostPackage weekly;

    @BeforeEach
    public void setupPackage() {
        sellerId = newUserId();
        itemId = UUID.randomUUID();
        weekly = boostService.createPackage(ADMIN_ID, ActorRole.ADMIN,
                new CreateBoostPackageRequest("Weekly " + itemId, "Top of search for a week", 7, new BigDecimal("19.99")));
    }

    @Test
    public void onlyAdminsCreatePackages() {
        assertThatThrownBy(() -> boostService.createPackage(sellerId, ActorRole.SELLER,
                new CreateBoostPackageRequest("Cheap", null, 1, BigDecimal.ONE)))
                .isInstanceOf(ActorNotAuthorizedException.class);
    }

    @Test
    public void bankTransferPurchase_activatesOnAdminConfirmation() {
        BoostPurchase purchase = purchase(PaymentMethod.BANK_TRANSFER);
        assertThat(purchase.getAmount()).isEqualByComparingTo("19.99");
        assertThat(purchase.getPaymentLink()).isNull();

        workflowEngine.applyTransition(EntityType.BOOST_PURCHASE, purchase.getId(), WorkflowAction.SUBMIT_PAYMENT,
                sellerId, ActorRole.SELLER,
                new TransitionPayload(null, null, null, null, null, null, "TRX-9", "https://files.test/slip.jpg", null));
        TransitionResult paid = workflowEngine.applyTransition(EntityType.BOOST_PURCHASE, purchase.getId(),
                WorkflowAction.MARK_PAID, ADMIN_ID, ActorRole.ADMIN, null);

        assertThat(paid.status()).isEqualTo(BoostPurchaseStatus.PAID.name());
        assertThat(paid.sideEffects()).extracting(SideEffect::type).contains(SideEffectType.BOOSTED_ITEM_ACTIVATED);

        BoostPurchase stored = boostService.getPurchase(purchase.getId(), sellerId, ActorRole.SELLER);
        assertThat(stored.getBoostedItemId()).isNotNull();
        assertThat(stored.getPaymentReference()).isEqualTo("TRX-9");
        assertThat(liveBoostsOfItem()).hasSize(1);
        assertThat(notificationTypesOf(sellerId)).contains(NotificationType.BOOST_ACTIVATED);
    }

    @Test
    public void secondPurchase_extendsLiveBoost() {
        BoostPurchase first = purchase(PaymentMethod.BANK_TRANSFER);
        markPaid(first);
        LocalDateTime firstEnd = liveBoostsOfItem().get(0).getEndDate();

        BoostPurchase second = purchase(PaymentMethod.BANK_TRANSFER);
        markPaid(second);

        List<BoostedItem> live = liveBoostsOfItem();
        assertThat(live).hasSize(1);
        assertThat(live.get(0).getEndDate()).isEqualTo(firstEnd.plusDays(7));
        assertThat(boostService.getPurchase(second.getId(), sellerId, ActorRole.SELLER).getBoostedItemId())
                .isEqualTo(live.get(0).getId());
    }

    @Test
    public void gatewayPurchase_paidAndFailedThroughCallback() {
        BoostPurchase paid = purchase(PaymentMethod.IPG);
        BoostPurchase failed = purchase(PaymentMethod.IPG);

        paymentCallbackService.onPaymentResult(new PaymentResultRequest(referenceOf(paid), PaymentOutcome.SUCCESS, "GW-10"));
        paymentCallbackService.onPaymentResult(new PaymentResultRequest(referenceOf(failed), PaymentOutcome.FAILURE, null));

        assertThat(boostService.getPurchase(paid.getId(), sellerId, ActorRole.SELLER).getStatus())
                .isEqualTo(BoostPurchaseStatus.PAID);
        assertThat(boostService.getPurchase(failed.getId(), sellerId, ActorRole.SELLER).getStatus())
                .isEqualTo(BoostPurchaseStatus.FAILED);
        assertThat(notificationTypesOf(sellerId)).contains(NotificationType.BOOST_PAYMENT_FAILED);
    }

    @Test
    public void concurrentFirstActivations_leaveOneLiveBoost() throws Exception {
        BoostPurchase first = purchase(PaymentMethod.IPG);
        BoostPurchase second = purchase(PaymentMethod.IPG);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            CompletableFuture<Void> allOf = CompletableFuture.allOf(
                    confirmAfter(start, first, pool),
                    confirmAfter(start, second, pool)
            );
            start.countDown();
            allOf.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdown();
        }

        List<BoostedItem> live = liveBoostsOfItem();
        assertThat(live).hasSize(1);
        assertThat(live.get(0).getEndDate()).isAfter(LocalDateTime.now().plusDays(13));
        assertThat(boostService.getPurchase(first.getId(), sellerId, ActorRole.SELLER).getBoostedItemId())
                .isEqualTo(live.get(0).getId());
        assertThat(boostService.getPurchase(second.getId(), sellerId, ActorRole.SELLER).getBoostedItemId())
                .isEqualTo(live.get(0).getId());
    }

    @Test
    public void gatewayPurchaseTakesNoSlip() {
        BoostPurchase purchase = purchase(PaymentMethod.IPG);

        assertThatThrownBy(() -> workflowEngine.applyTransition(EntityType.BOOST_PURCHASE, purchase.getId(),
                WorkflowAction.SUBMIT_PAYMENT, sellerId, ActorRole.SELLER,
                new TransitionPayload(null, null, null, null, null, null, null, "https://files.test/slip.jpg", null)))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    public void adminBoostRefusedWhileItemIsLive() {
        boostService.createBoostedItem(ADMIN_ID, ActorRole.ADMIN,
                new CreateBoostedItemRequest(itemId, ItemType.PRODUCT, weekly.getId(), sellerId));

        assertThatThrownBy(() -> boostService.createBoostedItem(ADMIN_ID, ActorRole.ADMIN,
                new CreateBoostedItemRequest(itemId, ItemType.PRODUCT, weekly.getId(), sellerId)))
                .isInstanceOf(DuplicateActiveResourceException.class);
    }

    @Test
    public void expiredBoostsAreDeactivated() {
        BoostedItem boosted = boostService.createBoostedItem(ADMIN_ID, ActorRole.ADMIN,
                new CreateBoostedItemRequest(itemId, ItemType.PRODUCT, weekly.getId(), sellerId));
        boosted.setEndDate(LocalDateTime.now().minusHours(1));
        boostedItemRepository.saveAndFlush(boosted);

        assertThat(liveBoostsOfItem()).isEmpty();
        assertThat(boostService.expireBoostedItems(ADMIN_ID, ActorRole.ADMIN)).isGreaterThanOrEqualTo(1);
        assertThat(boostedItemRepository.findById(boosted.getId()).orElseThrow().isActive()).isFalse();
    }

    private BoostPurchase purchase(PaymentMethod paymentMethod) {
        return boostService.createPurchase(sellerId, ActorRole.SELLER,
                new CreateBoostPurchaseRequest(weekly.getId(), itemId, ItemType.PRODUCT, paymentMethod));
    }

    private void markPaid(BoostPurchase purchase) {
        workflowEngine.applyTransition(EntityType.BOOST_PURCHASE, purchase.getId(), WorkflowAction.MARK_PAID,
                ADMIN_ID, ActorRole.ADMIN, null);
    }

    private List<BoostedItem> liveBoostsOfItem() {
        return boostService.listActiveBoosts(ItemType.PRODUCT).stream()
                .filter(b -> b.getItemId().equals(itemId))
                .toList();
    }

    private CompletableFuture<Void> confirmAfter(CountDownLatch start, BoostPurchase purchase, ExecutorService pool) {
        UUID reference = referenceOf(purchase);
        return CompletableFuture.runAsync(() -> {
            try {
                start.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            paymentCallbackService.onPaymentResult(new PaymentResultRequest(reference, PaymentOutcome.SUCCESS, null));
        }, pool);
    }

    // The hosted page URL ends with the session reference
    private static UUID referenceOf(BoostPurchase purchase) {
        List<String> segments = UriComponentsBuilder.fromUriString(purchase.getPaymentLink()).build().getPathSegments();
        return UUID.fromString(segments.get(segments.size() - 1));
    }
}

package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.BoostPurchaseStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.mapper.BoostMapper;
import com.nosota.tradeflow.model.BoostPackage;
import com.nosota.tradeflow.model.BoostPurchase;
import com.nosota.tradeflow.model.BoostedItem;
import com.nosota.tradeflow.repository.BoostPackageRepository;
import com.nosota.tradeflow.repository.BoostPurchaseRepository;
import com.nosota.tradeflow.service.BoostActivation;
import com.nosota.tradeflow.statemachine.TransitionTable;
import com.nosota.tradeflow.statemachine.TransitionTables;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Boost purchase moves. Only the seller is a party; confirmation activates or extends the
 * item's boost in the same transaction.
 */
@Component
public class BoostPurchaseWorkflowHandler extends AbstractWorkflowHandler<BoostPurchase, BoostPurchaseStatus> {

    private final BoostPurchaseRepository boostPurchaseRepository;
    private final BoostPackageRepository boostPackageRepository;
    private final BoostActivation boostActivation;

    public BoostPurchaseWorkflowHandler(SideEffectFactory sideEffects, BoostPurchaseRepository boostPurchaseRepository,
                                        BoostPackageRepository boostPackageRepository,
                                        BoostActivation boostActivation) {
        super(sideEffects);
        this.boostPurchaseRepository = boostPurchaseRepository;
        this.boostPackageRepository = boostPackageRepository;
        this.boostActivation = boostActivation;
    }

    @Override
    public EntityType entityType() {
        return EntityType.BOOST_PURCHASE;
    }

    @Override
    public TransitionTable<BoostPurchaseStatus> table() {
        return TransitionTables.BOOST_PURCHASE;
    }

    @Override
    public BoostPurchase load(UUID id) {
        return boostPurchaseRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.BOOST_PURCHASE, id));
    }

    @Override
    public BoostPurchaseStatus statusOf(BoostPurchase purchase) {
        return purchase.getStatus();
    }

    @Override
    public void setStatus(BoostPurchase purchase, BoostPurchaseStatus status) {
        purchase.setStatus(status);
    }

    @Override
    public Long buyerOf(BoostPurchase purchase) {
        return null;
    }

    @Override
    public Long sellerOf(BoostPurchase purchase) {
        return purchase.getSellerId();
    }

    @Override
    public UUID conversationOf(BoostPurchase purchase) {
        return null;
    }

    @Override
    protected String linkOf(BoostPurchase purchase) {
        return "/boosts/purchases/" + purchase.getId();
    }

    @Override
    public void onTransition(BoostPurchase purchase, TransitionContext ctx) {
        TransitionPayload payload = ctx.getPayload();

        switch (ctx.getAction()) {
            case SUBMIT_PAYMENT -> {
                if (purchase.getPaymentMethod() == PaymentMethod.IPG) {
                    throw guardFailed(purchase, ctx, "gateway purchases are paid through the payment link");
                }
                if (isBlank(payload.paymentSlipUrl())) {
                    throw guardFailed(purchase, ctx, "a payment slip is required");
                }
                purchase.setPaymentSlipUrl(payload.paymentSlipUrl());
                purchase.setPaymentReference(payload.paymentReference());
            }
            case MARK_PAID -> {
                BoostPackage boostPackage = boostPackageRepository.findById(purchase.getPackageId())
                        .orElseThrow(() -> new EntityNotFoundException("BOOST_PACKAGE", purchase.getPackageId()));
                BoostedItem boosted = boostActivation.activate(purchase.getItemId(), purchase.getItemType(),
                        purchase.getSellerId(), boostPackage);
                purchase.setBoostedItemId(boosted.getId());
                purchase.setPaidAt(LocalDateTime.now());
                if (!isBlank(payload.paymentReference())) {
                    purchase.setPaymentReference(payload.paymentReference());
                }
                ctx.record(new SideEffect(SideEffectType.BOOSTED_ITEM_ACTIVATED, boosted.getId(),
                        "boosted until " + boosted.getEndDate()));
                notifyParty(purchase, ctx, purchase.getSellerId(), NotificationType.BOOST_ACTIVATED,
                        "Boost active", boostPackage.getName() + " is active until " + boosted.getEndDate());
            }
            case FAIL -> notifyParty(purchase, ctx, purchase.getSellerId(), NotificationType.BOOST_PAYMENT_FAILED,
                    "Boost payment failed", "The payment for your boost did not go through");
            case CANCEL -> notifyParty(purchase, ctx, purchase.getSellerId(), NotificationType.BOOST_CANCELLED,
                    "Boost cancelled", "Your boost purchase was cancelled");
            default -> throw guardFailed(purchase, ctx, "no boost purchase behaviour for " + ctx.getAction());
        }
    }

    @Override
    public BoostPurchase save(BoostPurchase purchase) {
        return boostPurchaseRepository.saveAndFlush(purchase);
    }

    @Override
    public Long versionOf(BoostPurchase purchase) {
        return purchase.getVersion();
    }

    @Override
    public Object toResponse(BoostPurchase purchase) {
        return BoostMapper.INSTANCE.toResponse(purchase);
    }
}

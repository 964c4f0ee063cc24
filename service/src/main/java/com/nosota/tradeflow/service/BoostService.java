package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.BoostPurchaseStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.request.CreateBoostPackageRequest;
import com.nosota.tradeflow.api.request.CreateBoostPurchaseRequest;
import com.nosota.tradeflow.api.request.CreateBoostedItemRequest;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.error.DuplicateActiveResourceException;
import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.model.BoostPackage;
import com.nosota.tradeflow.model.BoostPurchase;
import com.nosota.tradeflow.model.BoostedItem;
import com.nosota.tradeflow.model.PaymentSession;
import com.nosota.tradeflow.repository.AdvisoryLockRepository;
import com.nosota.tradeflow.repository.BoostPackageRepository;
import com.nosota.tradeflow.repository.BoostPurchaseRepository;
import com.nosota.tradeflow.repository.BoostedItemRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Boost packages, purchases and boosted items. Purchase payment moves go through the workflow
 * engine; confirmation activates the boost.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BoostService {

    private static final String CURRENCY = "USD";

    private final BoostPackageRepository boostPackageRepository;
    private final BoostPurchaseRepository boostPurchaseRepository;
    private final BoostedItemRepository boostedItemRepository;
    private final AdvisoryLockRepository advisoryLockRepository;
    private final PaymentSessionService paymentSessionService;

    @Transactional
    public BoostPackage createPackage(Long actorId, ActorRole actorRole, CreateBoostPackageRequest request) {
        requireAdmin(actorId, actorRole, "create boost package");

        BoostPackage boostPackage = new BoostPackage();
        boostPackage.setName(request.name());
        boostPackage.setDescription(request.description());
        boostPackage.setDurationDays(request.durationDays());
        boostPackage.setPrice(request.price());
        boostPackage.setActive(true);
        boostPackage.setCreatedAt(LocalDateTime.now());

        BoostPackage saved = boostPackageRepository.save(boostPackage);
        log.info("Boost package {} '{}' created: {} days for {}", saved.getId(), saved.getName(),
                saved.getDurationDays(), saved.getPrice());
        return saved;
    }

    public List<BoostPackage> listPackages() {
        return boostPackageRepository.findByActiveTrueOrderByPriceAsc();
    }

    /**
     * Creates a PENDING purchase at the package price. Gateway purchases get a payment link
     * right away; bank transfers wait for a slip.
     */
    @Transactional
    public BoostPurchase createPurchase(Long actorId, ActorRole actorRole, CreateBoostPurchaseRequest request) {
        ActorAccess.requireRole(EntityType.BOOST_PURCHASE, null, actorId, actorRole, ActorRole.SELLER, "create");
        BoostPackage boostPackage = boostPackageRepository.findById(request.packageId())
                .filter(BoostPackage::isActive)
                .orElseThrow(() -> new EntityNotFoundException("BOOST_PACKAGE", request.packageId()));

        BoostPurchase purchase = new BoostPurchase();
        purchase.setSellerId(actorId);
        purchase.setPackageId(boostPackage.getId());
        purchase.setItemId(request.itemId());
        purchase.setItemType(request.itemType());
        purchase.setPaymentMethod(request.paymentMethod());
        purchase.setAmount(boostPackage.getPrice());
        purchase.setCurrency(CURRENCY);
        purchase.setStatus(BoostPurchaseStatus.PENDING);
        BoostPurchase saved = boostPurchaseRepository.saveAndFlush(purchase);

        if (saved.getPaymentMethod() == PaymentMethod.IPG) {
            PaymentSession session = paymentSessionService.requestSession(EntityType.BOOST_PURCHASE,
                    saved.getId(), saved.getAmount());
            saved.setPaymentLink(session.getSessionUrl());
            saved = boostPurchaseRepository.saveAndFlush(saved);
        }

        log.info("Boost purchase {} created by seller {} for {} {} ({})", saved.getId(), actorId,
                saved.getItemType(), saved.getItemId(), saved.getPaymentMethod());
        return saved;
    }

    public BoostPurchase getPurchase(UUID purchaseId, Long actorId, ActorRole actorRole) {
        BoostPurchase purchase = boostPurchaseRepository.findById(purchaseId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.BOOST_PURCHASE, purchaseId));
        ActorAccess.requireParty(EntityType.BOOST_PURCHASE, purchaseId, null, purchase.getSellerId(),
                actorId, actorRole, "read");
        return purchase;
    }

    /**
     * Boosts an item without a purchase.
     *
     * @throws DuplicateActiveResourceException if the item already has a live boost
     */
    @Transactional
    public BoostedItem createBoostedItem(Long actorId, ActorRole actorRole, CreateBoostedItemRequest request) {
        requireAdmin(actorId, actorRole, "create boosted item");
        BoostPackage boostPackage = boostPackageRepository.findById(request.packageId())
                .orElseThrow(() -> new EntityNotFoundException("BOOST_PACKAGE", request.packageId()));

        advisoryLockRepository.lock(AdvisoryLockRepository.boostedItemKey(request.itemType(), request.itemId()));
        LocalDateTime now = LocalDateTime.now();
        for (BoostedItem existing : boostedItemRepository.findActiveForUpdate(request.itemId(), request.itemType())) {
            if (existing.isLiveAt(now)) {
                throw new DuplicateActiveResourceException("boosted item", request.itemId(), existing.getId());
            }
            existing.setActive(false);
            boostedItemRepository.save(existing);
        }

        BoostedItem boosted = new BoostedItem();
        boosted.setItemId(request.itemId());
        boosted.setItemType(request.itemType());
        boosted.setPackageId(boostPackage.getId());
        boosted.setSellerId(request.sellerId());
        boosted.setStartDate(now);
        boosted.setEndDate(now.plusDays(boostPackage.getDurationDays()));
        boosted.setActive(true);

        BoostedItem saved = boostedItemRepository.saveAndFlush(boosted);
        log.info("Admin {} boosted {} {} until {}", actorId, saved.getItemType(), saved.getItemId(), saved.getEndDate());
        return saved;
    }

    /**
     * Live boosts, soonest to end first. Rows past their end date are excluded even before
     * the sweep deactivates them.
     */
    public List<BoostedItem> listActiveBoosts(ItemType itemType) {
        return boostedItemRepository.findLive(itemType, LocalDateTime.now());
    }

    @Transactional
    public int expireBoostedItems(Long actorId, ActorRole actorRole) {
        requireAdmin(actorId, actorRole, "expire boosted items");
        return expireBoostedItems();
    }

    /**
     * Deactivates boosted items whose end date has passed.
     *
     * @return number of items deactivated
     */
    @Transactional
    public int expireBoostedItems() {
        int expired = boostedItemRepository.deactivateExpired(LocalDateTime.now());
        if (expired > 0) {
            log.info("Deactivated {} expired boosted items", expired);
        }
        return expired;
    }

    private static void requireAdmin(Long actorId, ActorRole actorRole, String operation) {
        if (actorRole != ActorRole.ADMIN && actorRole != ActorRole.SYSTEM) {
            throw new ActorNotAuthorizedException(EntityType.BOOST_PURCHASE, null, actorId, actorRole, operation);
        }
    }
}

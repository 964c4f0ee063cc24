package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.model.BoostPackage;
import com.nosota.tradeflow.model.BoostedItem;
import com.nosota.tradeflow.repository.AdvisoryLockRepository;
import com.nosota.tradeflow.repository.BoostedItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Activates a paid boost. An advisory lock on the item is taken first, so two confirmations
 * for the same item serialize even when it has no boost row yet, and at most one live boost
 * remains.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BoostActivation {

    private final BoostedItemRepository boostedItemRepository;
    private final AdvisoryLockRepository advisoryLockRepository;

    /**
     * Extends the item's live boost by the package duration, or starts a new one.
     *
     * @return the live boosted item
     */
    public BoostedItem activate(UUID itemId, ItemType itemType, Long sellerId,
                                BoostPackage boostPackage) {
        advisoryLockRepository.lock(AdvisoryLockRepository.boostedItemKey(itemType, itemId));
        LocalDateTime now = LocalDateTime.now();
        List<BoostedItem> active = boostedItemRepository.findActiveForUpdate(itemId, itemType);

        Optional<BoostedItem> live = active.stream().filter(b -> b.isLiveAt(now)).findFirst();
        for (BoostedItem stale : active) {
            if (live.isEmpty() || stale != live.get()) {
                stale.setActive(false);
                boostedItemRepository.save(stale);
            }
        }

        if (live.isPresent()) {
            BoostedItem boosted = live.get();
            boosted.setEndDate(boosted.getEndDate().plusDays(boostPackage.getDurationDays()));
            boosted.setPackageId(boostPackage.getId());
            BoostedItem saved = boostedItemRepository.saveAndFlush(boosted);
            log.info("Extended boost {} of {} {} until {}", saved.getId(), itemType, itemId, saved.getEndDate());
            return saved;
        }

        BoostedItem boosted = new BoostedItem();
        boosted.setItemId(itemId);
        boosted.setItemType(itemType);
        boosted.setPackageId(boostPackage.getId());
        boosted.setSellerId(sellerId);
        boosted.setStartDate(now);
        boosted.setEndDate(now.plusDays(boostPackage.getDurationDays()));
        boosted.setActive(true);
        BoostedItem saved = boostedItemRepository.saveAndFlush(boosted);
        log.info("Boosted {} {} until {}", itemType, itemId, saved.getEndDate());
        return saved;
    }
}

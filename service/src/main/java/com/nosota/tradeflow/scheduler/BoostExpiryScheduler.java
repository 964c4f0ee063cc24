package com.nosota.tradeflow.scheduler;

import com.nosota.tradeflow.service.BoostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deactivates boosted items whose end date has passed.
 *
 * <p>Reads already treat such items as inactive; the sweep keeps the active flag honest for
 * the "one active boost per item" check.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   boost-expiry:
 *     enabled: true          # enable/disable scheduler
 *     cron: "0 0/15 * * * *" # every 15 minutes
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.boost-expiry.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class BoostExpiryScheduler {

    private final BoostService boostService;

    @Scheduled(cron = "${scheduler.boost-expiry.cron:0 0/15 * * * *}")
    public void expireBoostedItems() {
        log.info("Starting scheduled job: expire boosted items");

        try {
            int expired = boostService.expireBoostedItems();

            if (expired > 0) {
                log.info("Expired {} boosted items", expired);
            } else {
                log.debug("No expired boosted items found");
            }

        } catch (Exception e) {
            log.error("Failed to expire boosted items: {}", e.getMessage(), e);
        }
    }
}

package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.api.request.CreateBoostPackageRequest;
import com.nosota.tradeflow.api.request.CreateBoostPurchaseRequest;
import com.nosota.tradeflow.api.request.CreateBoostedItemRequest;
import com.nosota.tradeflow.api.response.BoostPackageResponse;
import com.nosota.tradeflow.api.response.BoostPurchaseResponse;
import com.nosota.tradeflow.api.response.BoostedItemResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Boost API: paid promotional placement of products and services.
 *
 * <p>Implemented by BoostController (service) and BoostClient (api).
 */
@RequestMapping("/api/v1/boosts")
public interface BoostApi {

    @PostMapping("/packages")
    ResponseEntity<BoostPackageResponse> createPackage(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid CreateBoostPackageRequest request);

    @GetMapping("/packages")
    ResponseEntity<List<BoostPackageResponse>> listPackages();

    /**
     * Creates a purchase in PENDING. IPG purchases get a payment link; bank transfers are
     * confirmed by an admin after the slip is submitted.
     */
    @PostMapping("/purchases")
    ResponseEntity<BoostPurchaseResponse> createPurchase(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid CreateBoostPurchaseRequest request);

    @GetMapping("/purchases/{purchaseId}")
    ResponseEntity<BoostPurchaseResponse> getPurchase(
            @PathVariable("purchaseId") UUID purchaseId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    /**
     * Admin: boosts an item directly. Fails with 409 when the item already has an active boost.
     */
    @PostMapping("/items")
    ResponseEntity<BoostedItemResponse> createBoostedItem(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid CreateBoostedItemRequest request);

    @GetMapping("/items/active")
    ResponseEntity<List<BoostedItemResponse>> listActiveBoosts(
            @RequestParam(name = "itemType", required = false) ItemType itemType);

    /**
     * Admin: deactivates boosted items whose window has ended.
     *
     * @return Number of items deactivated
     */
    @PostMapping("/items/expire")
    ResponseEntity<Integer> expireBoostedItems(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);
}

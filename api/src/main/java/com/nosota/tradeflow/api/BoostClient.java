package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.api.request.CreateBoostPackageRequest;
import com.nosota.tradeflow.api.request.CreateBoostPurchaseRequest;
import com.nosota.tradeflow.api.request.CreateBoostedItemRequest;
import com.nosota.tradeflow.api.response.BoostPackageResponse;
import com.nosota.tradeflow.api.response.BoostPurchaseResponse;
import com.nosota.tradeflow.api.response.BoostedItemResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of BoostApi.
 */
@RequiredArgsConstructor
@Slf4j
public class BoostClient implements BoostApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<BoostPackageResponse> createPackage(Long actorId, ActorRole actorRole,
                                                              CreateBoostPackageRequest request) {
        log.debug("Calling createPackage: name={}, durationDays={}", request.name(), request.durationDays());

        return webClient.post()
                .uri("/api/v1/boosts/packages")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(BoostPackageResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<BoostPackageResponse>> listPackages() {
        return webClient.get()
                .uri("/api/v1/boosts/packages")
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<BoostPackageResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<BoostPurchaseResponse> createPurchase(Long actorId, ActorRole actorRole,
                                                                CreateBoostPurchaseRequest request) {
        log.debug("Calling createPurchase: packageId={}, itemId={}, itemType={}",
                request.packageId(), request.itemId(), request.itemType());

        return webClient.post()
                .uri("/api/v1/boosts/purchases")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(BoostPurchaseResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BoostPurchaseResponse> getPurchase(UUID purchaseId, Long actorId, ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/boosts/purchases/{purchaseId}", purchaseId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(BoostPurchaseResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BoostedItemResponse> createBoostedItem(Long actorId, ActorRole actorRole,
                                                                 CreateBoostedItemRequest request) {
        log.debug("Calling createBoostedItem: itemId={}, itemType={}", request.itemId(), request.itemType());

        return webClient.post()
                .uri("/api/v1/boosts/items")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(BoostedItemResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<BoostedItemResponse>> listActiveBoosts(ItemType itemType) {
        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/api/v1/boosts/items/active");
                    if (itemType != null) {
                        uriBuilder.queryParam("itemType", itemType);
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<BoostedItemResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<Integer> expireBoostedItems(Long actorId, ActorRole actorRole) {
        return webClient.post()
                .uri("/api/v1/boosts/items/expire")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(Integer.class)
                .block();
    }
}

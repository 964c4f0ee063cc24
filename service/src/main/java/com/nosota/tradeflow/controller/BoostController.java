package com.nosota.tradeflow.controller;

import com.nosota.tradeflow.api.BoostApi;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.api.request.CreateBoostPackageRequest;
import com.nosota.tradeflow.api.request.CreateBoostPurchaseRequest;
import com.nosota.tradeflow.api.request.CreateBoostedItemRequest;
import com.nosota.tradeflow.api.response.BoostPackageResponse;
import com.nosota.tradeflow.api.response.BoostPurchaseResponse;
import com.nosota.tradeflow.api.response.BoostedItemResponse;
import com.nosota.tradeflow.mapper.BoostMapper;
import com.nosota.tradeflow.service.BoostService;
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
public class BoostController implements BoostApi {

    private static final BoostMapper MAPPER = BoostMapper.INSTANCE;

    private final BoostService boostService;

    @Override
    public ResponseEntity<BoostPackageResponse> createPackage(Long actorId, ActorRole actorRole,
                                                              CreateBoostPackageRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MAPPER.toResponse(
                boostService.createPackage(actorId, ExternalActor.require(actorRole), request)));
    }

    @Override
    public ResponseEntity<List<BoostPackageResponse>> listPackages() {
        return ResponseEntity.ok(MAPPER.toPackageResponseList(boostService.listPackages()));
    }

    @Override
    public ResponseEntity<BoostPurchaseResponse> createPurchase(Long actorId, ActorRole actorRole,
                                                                CreateBoostPurchaseRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MAPPER.toResponse(
                boostService.createPurchase(actorId, ExternalActor.require(actorRole), request)));
    }

    @Override
    public ResponseEntity<BoostPurchaseResponse> getPurchase(UUID purchaseId, Long actorId, ActorRole actorRole) {
        return ResponseEntity.ok(MAPPER.toResponse(
                boostService.getPurchase(purchaseId, actorId, ExternalActor.require(actorRole))));
    }

    @Override
    public ResponseEntity<BoostedItemResponse> createBoostedItem(Long actorId, ActorRole actorRole,
                                                                 CreateBoostedItemRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MAPPER.toResponse(
                boostService.createBoostedItem(actorId, ExternalActor.require(actorRole), request)));
    }

    @Override
    public ResponseEntity<List<BoostedItemResponse>> listActiveBoosts(ItemType itemType) {
        return ResponseEntity.ok(MAPPER.toBoostedItemResponseList(boostService.listActiveBoosts(itemType)));
    }

    @Override
    public ResponseEntity<Integer> expireBoostedItems(Long actorId, ActorRole actorRole) {
        return ResponseEntity.ok(boostService.expireBoostedItems(actorId, ExternalActor.require(actorRole)));
    }
}

package com.nosota.tradeflow.controller;

import com.nosota.tradeflow.api.FulfillmentApi;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.request.CreateBookingRequest;
import com.nosota.tradeflow.api.request.CreateOrderRequest;
import com.nosota.tradeflow.api.request.CreateReturnRequest;
import com.nosota.tradeflow.api.response.BookingResponse;
import com.nosota.tradeflow.api.response.LedgerEntryResponse;
import com.nosota.tradeflow.api.response.OrderResponse;
import com.nosota.tradeflow.api.response.ReturnRequestResponse;
import com.nosota.tradeflow.error.ActorNotAuthorizedException;
import com.nosota.tradeflow.mapper.CommerceMapper;
import com.nosota.tradeflow.service.BookingService;
import com.nosota.tradeflow.service.CommissionLedgerService;
import com.nosota.tradeflow.service.OrderService;
import com.nosota.tradeflow.service.ReturnService;
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
public class FulfillmentController implements FulfillmentApi {

    private static final CommerceMapper MAPPER = CommerceMapper.INSTANCE;

    private final OrderService orderService;
    private final BookingService bookingService;
    private final ReturnService returnService;
    private final CommissionLedgerService commissionLedgerService;

    @Override
    public ResponseEntity<OrderResponse> createOrder(Long actorId, ActorRole actorRole, CreateOrderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MAPPER.toResponse(
                orderService.createOrder(actorId, ExternalActor.require(actorRole), request)));
    }

    @Override
    public ResponseEntity<OrderResponse> getOrder(UUID orderId, Long actorId, ActorRole actorRole) {
        return ResponseEntity.ok(MAPPER.toResponse(
                orderService.getOrder(orderId, actorId, ExternalActor.require(actorRole))));
    }

    @Override
    public ResponseEntity<BookingResponse> createBooking(Long actorId, ActorRole actorRole,
                                                         CreateBookingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MAPPER.toResponse(
                bookingService.createBooking(actorId, ExternalActor.require(actorRole), request)));
    }

    @Override
    public ResponseEntity<BookingResponse> getBooking(UUID bookingId, Long actorId, ActorRole actorRole) {
        return ResponseEntity.ok(MAPPER.toResponse(
                bookingService.getBooking(bookingId, actorId, ExternalActor.require(actorRole))));
    }

    @Override
    public ResponseEntity<ReturnRequestResponse> fileReturn(Long actorId, ActorRole actorRole,
                                                            CreateReturnRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MAPPER.toResponse(
                returnService.fileReturn(actorId, ExternalActor.require(actorRole), request)));
    }

    @Override
    public ResponseEntity<ReturnRequestResponse> getReturn(UUID returnRequestId, Long actorId, ActorRole actorRole) {
        return ResponseEntity.ok(MAPPER.toResponse(
                returnService.getReturn(returnRequestId, actorId, ExternalActor.require(actorRole))));
    }

    @Override
    public ResponseEntity<List<ReturnRequestResponse>> listReturnAttempts(EntityType parentType, UUID parentId,
                                                                          Long actorId, ActorRole actorRole) {
        return ResponseEntity.ok(MAPPER.toReturnResponseList(
                returnService.listReturnAttempts(parentType, parentId, actorId, ExternalActor.require(actorRole))));
    }

    @Override
    public ResponseEntity<List<LedgerEntryResponse>> getLedgerEntries(EntityType entityType, UUID entityId,
                                                                      Long actorId, ActorRole actorRole) {
        if (ExternalActor.require(actorRole) != ActorRole.ADMIN) {
            throw new ActorNotAuthorizedException(entityType, entityId, actorId, actorRole, "read ledger of");
        }
        return ResponseEntity.ok(MAPPER.toLedgerResponseList(
                commissionLedgerService.listEntries(entityType, entityId)));
    }
}

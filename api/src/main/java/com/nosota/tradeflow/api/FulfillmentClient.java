package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.request.CreateBookingRequest;
import com.nosota.tradeflow.api.request.CreateOrderRequest;
import com.nosota.tradeflow.api.request.CreateReturnRequest;
import com.nosota.tradeflow.api.response.BookingResponse;
import com.nosota.tradeflow.api.response.LedgerEntryResponse;
import com.nosota.tradeflow.api.response.OrderResponse;
import com.nosota.tradeflow.api.response.ReturnRequestResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of FulfillmentApi.
 */
@RequiredArgsConstructor
@Slf4j
public class FulfillmentClient implements FulfillmentApi {

    private final WebClient webClient;

    // ==================== Orders ====================

    @Override
    public ResponseEntity<OrderResponse> createOrder(Long actorId, ActorRole actorRole, CreateOrderRequest request) {
        log.debug("Calling createOrder: productId={}, sellerId={}, quantity={}",
                request.productId(), request.sellerId(), request.quantity());

        return webClient.post()
                .uri("/api/v1/fulfillment/orders")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(OrderResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<OrderResponse> getOrder(UUID orderId, Long actorId, ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/fulfillment/orders/{orderId}", orderId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(OrderResponse.class)
                .block();
    }

    // ==================== Bookings ====================

    @Override
    public ResponseEntity<BookingResponse> createBooking(Long actorId, ActorRole actorRole,
                                                         CreateBookingRequest request) {
        log.debug("Calling createBooking: serviceId={}, sellerId={}, scheduledDate={}",
                request.serviceId(), request.sellerId(), request.scheduledDate());

        return webClient.post()
                .uri("/api/v1/fulfillment/bookings")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(BookingResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BookingResponse> getBooking(UUID bookingId, Long actorId, ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/fulfillment/bookings/{bookingId}", bookingId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(BookingResponse.class)
                .block();
    }

    // ==================== Returns ====================

    @Override
    public ResponseEntity<ReturnRequestResponse> fileReturn(Long actorId, ActorRole actorRole,
                                                            CreateReturnRequest request) {
        log.debug("Calling fileReturn: orderId={}, bookingId={}, reason={}",
                request.orderId(), request.bookingId(), request.reason());

        return webClient.post()
                .uri("/api/v1/fulfillment/returns")
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(ReturnRequestResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReturnRequestResponse> getReturn(UUID returnRequestId, Long actorId, ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/fulfillment/returns/{returnRequestId}", returnRequestId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(ReturnRequestResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<ReturnRequestResponse>> listReturnAttempts(EntityType parentType, UUID parentId,
                                                                         Long actorId, ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/fulfillment/{parentType}/{parentId}/returns", parentType, parentId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<ReturnRequestResponse>>() {})
                .block();
    }

    // ==================== Commission ledger ====================

    @Override
    public ResponseEntity<List<LedgerEntryResponse>> getLedgerEntries(EntityType entityType, UUID entityId,
                                                                     Long actorId, ActorRole actorRole) {
        return webClient.get()
                .uri("/api/v1/fulfillment/ledger/{entityType}/{entityId}", entityType, entityId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<LedgerEntryResponse>>() {})
                .block();
    }
}

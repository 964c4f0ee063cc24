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
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Fulfillment API: orders, bookings, return attempts and the commission ledger.
 *
 * <p>Status changes go through {@link WorkflowApi}.
 *
 * <p>Implemented by FulfillmentController (service) and FulfillmentClient (api).
 */
@RequestMapping("/api/v1/fulfillment")
public interface FulfillmentApi {

    // ==================== Orders ====================

    @PostMapping("/orders")
    ResponseEntity<OrderResponse> createOrder(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid CreateOrderRequest request);

    @GetMapping("/orders/{orderId}")
    ResponseEntity<OrderResponse> getOrder(
            @PathVariable("orderId") UUID orderId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    // ==================== Bookings ====================

    @PostMapping("/bookings")
    ResponseEntity<BookingResponse> createBooking(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid CreateBookingRequest request);

    @GetMapping("/bookings/{bookingId}")
    ResponseEntity<BookingResponse> getBooking(
            @PathVariable("bookingId") UUID bookingId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    // ==================== Returns ====================

    /**
     * Files a return attempt. Fails with 422 once the attempt limit is reached and with 409
     * while the previous attempt is still open.
     */
    @PostMapping("/returns")
    ResponseEntity<ReturnRequestResponse> fileReturn(
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole,
            @RequestBody @Valid CreateReturnRequest request);

    @GetMapping("/returns/{returnRequestId}")
    ResponseEntity<ReturnRequestResponse> getReturn(
            @PathVariable("returnRequestId") UUID returnRequestId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    /**
     * Lists all return attempts of an order or booking in attempt order.
     *
     * @param parentType ORDER or BOOKING
     * @param parentId   Order or booking ID
     */
    @GetMapping("/{parentType}/{parentId}/returns")
    ResponseEntity<List<ReturnRequestResponse>> listReturnAttempts(
            @PathVariable("parentType") EntityType parentType,
            @PathVariable("parentId") UUID parentId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);

    // ==================== Commission ledger ====================

    @GetMapping("/ledger/{entityType}/{entityId}")
    ResponseEntity<List<LedgerEntryResponse>> getLedgerEntries(
            @PathVariable("entityType") EntityType entityType,
            @PathVariable("entityId") UUID entityId,
            @RequestHeader(ActorHeaders.ACTOR_ID) Long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) ActorRole actorRole);
}

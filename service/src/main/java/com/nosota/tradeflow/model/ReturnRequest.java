package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.ReturnReason;
import com.nosota.tradeflow.api.model.ReturnRequestStatus;
import com.nosota.tradeflow.api.model.SellerResponseStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One return attempt for an order or a booking (exactly one of the two is set).
 *
 * <p>Attempts are never reused: a new claim after a rejected one is a new row with the next
 * attempt number, and the previous row is left untouched as history.
 */
@Entity
@Table(name = "return_request", uniqueConstraints = {
        @UniqueConstraint(name = "uk_return_order_attempt", columnNames = {"order_id", "attempt_number"}),
        @UniqueConstraint(name = "uk_return_booking_attempt", columnNames = {"booking_id", "attempt_number"})
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ReturnRequest {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "order_id")
    private UUID orderId;

    @Column(name = "booking_id")
    private UUID bookingId;

    @Column(name = "conversation_id")
    private UUID conversationId;

    @Column(name = "buyer_id", nullable = false)
    private Long buyerId;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 30)
    private ReturnReason reason;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "return_request_evidence", joinColumns = @JoinColumn(name = "return_request_id"))
    @OrderColumn(name = "position")
    @Column(name = "url", length = 2048)
    private List<String> evidenceUrls = new ArrayList<>();

    @Column(name = "requested_refund_amount", precision = 19, scale = 2)
    private BigDecimal requestedRefundAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReturnRequestStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "seller_status", nullable = false, length = 20)
    private SellerResponseStatus sellerStatus;

    @Column(name = "seller_response", length = 2000)
    private String sellerResponse;

    @Column(name = "seller_proposed_refund_amount", precision = 19, scale = 2)
    private BigDecimal sellerProposedRefundAmount;

    @Column(name = "seller_responded_at")
    private LocalDateTime sellerRespondedAt;

    @Column(name = "admin_notes", length = 2000)
    private String adminNotes;

    @Column(name = "approved_refund_amount", precision = 19, scale = 2)
    private BigDecimal approvedRefundAmount;

    @Column(name = "commission_reversed_amount", precision = 19, scale = 2)
    private BigDecimal commissionReversedAmount;

    @Column(name = "under_review_at")
    private LocalDateTime underReviewAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public EntityType getParentType() {
        return orderId != null ? EntityType.ORDER : EntityType.BOOKING;
    }

    public UUID getParentId() {
        return orderId != null ? orderId : bookingId;
    }

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}

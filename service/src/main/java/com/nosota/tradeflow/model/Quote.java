package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.QuoteStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Seller-proposed custom price for a product or service, negotiated inside a conversation.
 *
 * <p>At most one quote per conversation is open ({@code pending} or {@code sent}); opening a
 * new one supersedes the others. Expiry is lazy: a quote past {@link #expiresAt} keeps its
 * stored status until it is read or accepted.
 */
@Entity
@Table(name = "quote", indexes = @Index(name = "idx_quote_conversation", columnList = "conversation_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Quote {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "conversation_id", nullable = false)
    private UUID conversationId;

    @Column(name = "buyer_id", nullable = false)
    private Long buyerId;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "product_id")
    private UUID productId;

    @Column(name = "service_id")
    private UUID serviceId;

    @Column(name = "product_variant_id")
    private UUID productVariantId;

    @Column(name = "service_package_id")
    private UUID servicePackageId;

    /**
     * Null while the quote is {@code requested} by the buyer.
     */
    @Column(name = "quoted_price", precision = 19, scale = 2)
    private BigDecimal quotedPrice;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "specifications", columnDefinition = "TEXT")
    private String specifications;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private QuoteStatus status;

    @Column(name = "design_approval_id")
    private UUID designApprovalId;

    @Column(name = "rejection_reason", length = 2000)
    private String rejectionReason;

    @Column(name = "accepted_at")
    private LocalDateTime acceptedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && now.isAfter(expiresAt);
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

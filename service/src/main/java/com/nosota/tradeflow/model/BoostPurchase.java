package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.BoostPurchaseStatus;
import com.nosota.tradeflow.api.model.ItemType;
import com.nosota.tradeflow.api.model.PaymentMethod;
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
 * Seller's purchase of a boost package for one product or service.
 *
 * <p>Paying the purchase activates (or extends) the item's {@link BoostedItem}; see
 * {@code BoostActivation}.
 */
@Entity
@Table(name = "boost_purchase", indexes = @Index(name = "idx_boost_purchase_seller", columnList = "seller_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BoostPurchase {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "package_id", nullable = false)
    private UUID packageId;

    @Column(name = "item_id", nullable = false)
    private UUID itemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, length = 20)
    private ItemType itemType;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BoostPurchaseStatus status;

    @Column(name = "payment_slip_url", length = 2048)
    private String paymentSlipUrl;

    @Column(name = "payment_reference")
    private String paymentReference;

    @Column(name = "payment_link", length = 2048)
    private String paymentLink;

    @Column(name = "boosted_item_id")
    private UUID boostedItemId;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

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

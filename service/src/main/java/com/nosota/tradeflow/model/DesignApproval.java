package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.DesignApprovalStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Buyer-submitted design artifact awaiting seller sign-off.
 */
@Entity
@Table(name = "design_approval",
        indexes = @Index(name = "idx_design_approval_conversation", columnList = "conversation_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class DesignApproval {

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

    @Column(name = "variant_id")
    private UUID variantId;

    @Column(name = "package_id")
    private UUID packageId;

    @Column(name = "quote_id")
    private UUID quoteId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "design_file", joinColumns = @JoinColumn(name = "design_approval_id"))
    @OrderColumn(name = "position")
    private List<DesignFile> designFiles = new ArrayList<>();

    @Column(name = "buyer_notes", length = 2000)
    private String buyerNotes;

    @Column(name = "seller_notes", length = 2000)
    private String sellerNotes;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DesignApprovalStatus status;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

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

package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.EntityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Handle requested from the payment gateway for an order, booking or boost purchase.
 *
 * <p>The id is the reference the gateway echoes back in its result callback.
 */
@Entity
@Table(name = "payment_session", indexes = @Index(name = "idx_payment_session_entity", columnList = "entity_type, entity_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class PaymentSession {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 30)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentSessionStatus status;

    @Column(name = "session_url", nullable = false, length = 2048)
    private String sessionUrl;

    @Column(name = "transaction_ref")
    private String transactionRef;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Version
    @Column(name = "version")
    private Long version;
}

package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.LedgerEntryType;
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
 * Commission ledger row.
 *
 * <p>A PAYOUT row records the seller payout of a completed order or booking. A REVERSAL row
 * carries negative amounts and points at the payout it reverses through
 * {@link #reversedEntryId}. Rows are append-only.
 */
@Entity
@Table(name = "ledger_entry", indexes = @Index(name = "idx_ledger_entity", columnList = "entity_type, entity_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LedgerEntry {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 30)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 20)
    private LedgerEntryType entryType;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "commission_rate", nullable = false, precision = 5, scale = 4)
    private BigDecimal commissionRate;

    @Column(name = "commission_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "seller_payout", nullable = false, precision = 19, scale = 2)
    private BigDecimal sellerPayout;

    @Column(name = "reversed_entry_id")
    private UUID reversedEntryId;

    @Column(name = "source_id")
    private UUID sourceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

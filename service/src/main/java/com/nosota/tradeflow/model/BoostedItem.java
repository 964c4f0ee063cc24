package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.ItemType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Active promotion window of one item. At most one active row exists per (itemId, itemType).
 */
@Entity
@Table(name = "boosted_item", indexes = @Index(name = "idx_boosted_item_item", columnList = "item_id, item_type"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BoostedItem {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "item_id", nullable = false)
    private UUID itemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, length = 20)
    private ItemType itemType;

    @Column(name = "package_id", nullable = false)
    private UUID packageId;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "start_date", nullable = false)
    private LocalDateTime startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDateTime endDate;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Active flag and end date together; a row whose window has passed but that the sweep has
     * not reached yet is not live.
     */
    public boolean isLiveAt(LocalDateTime now) {
        return active && endDate.isAfter(now);
    }
}

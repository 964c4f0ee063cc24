package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.ConversationStatus;
import com.nosota.tradeflow.api.model.ConversationType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Thread linking buyer, seller and (on demand) admins around one commerce context.
 *
 * <p>Messages are numbered by {@link #lastSequenceNumber}, which is only advanced while the
 * row is locked, so sequence numbers are gap free and strictly increasing per conversation.
 * Conversations are archived, never deleted; the cascade on messages only exists so that an
 * administrative purge does not leave orphans.
 */
@Entity
@Table(name = "conversation", indexes = {
        @Index(name = "idx_conversation_buyer", columnList = "buyer_id"),
        @Index(name = "idx_conversation_seller", columnList = "seller_id")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Conversation {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 40)
    private ConversationType type;

    @Column(name = "subject")
    private String subject;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ConversationStatus status;

    @Column(name = "buyer_id", nullable = false)
    private Long buyerId;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "product_id")
    private UUID productId;

    @Column(name = "service_id")
    private UUID serviceId;

    @Column(name = "order_id")
    private UUID orderId;

    @Column(name = "booking_id")
    private UUID bookingId;

    @Column(name = "last_sequence_number", nullable = false)
    private long lastSequenceNumber;

    @Column(name = "last_message_at")
    private LocalDateTime lastMessageAt;

    /**
     * Set when a buyer or seller asks an admin to resolve the conversation.
     */
    @Column(name = "resolution_requested_at")
    private LocalDateTime resolutionRequestedAt;

    @Column(name = "resolution_requested_by")
    private Long resolutionRequestedBy;

    @OneToMany(mappedBy = "conversation", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("joinedAt ASC")
    private List<ConversationParticipant> participants = new ArrayList<>();

    @OneToMany(mappedBy = "conversation", cascade = CascadeType.REMOVE)
    private List<Message> messages = new ArrayList<>();

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Optional<ConversationParticipant> findParticipant(Long userId) {
        return participants.stream()
                .filter(p -> p.getUserId().equals(userId))
                .findFirst();
    }

    public ConversationParticipant addParticipant(Long userId, ActorRole role) {
        ConversationParticipant participant = new ConversationParticipant();
        participant.setConversation(this);
        participant.setUserId(userId);
        participant.setRole(role);
        participant.setLastReadSequence(0L);
        participant.setJoinedAt(LocalDateTime.now());
        participants.add(participant);
        return participant;
    }

    public boolean isClosed() {
        return status == ConversationStatus.RESOLVED || status == ConversationStatus.ARCHIVED;
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

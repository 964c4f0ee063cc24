package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.ActorRole;
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
 * One message of a conversation. Never updated after insert.
 */
@Entity
@Table(name = "message",
        uniqueConstraints = @UniqueConstraint(name = "uk_message_conversation_sequence",
                columnNames = {"conversation_id", "sequence_number"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Message {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false, updatable = false)
    private Conversation conversation;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    /**
     * Null for system messages.
     */
    @Column(name = "sender_id", updatable = false)
    private Long senderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sender_role", length = 20, updatable = false)
    private ActorRole senderRole;

    @Column(name = "is_system", nullable = false, updatable = false)
    private boolean system;

    @Column(name = "content", columnDefinition = "TEXT", updatable = false)
    private String content;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "message_attachment", joinColumns = @JoinColumn(name = "message_id"))
    @OrderColumn(name = "position")
    private List<MessageAttachment> attachments = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

package com.nosota.tradeflow.model;

import com.nosota.tradeflow.api.model.ActorRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Membership of one user in a conversation, with that user's read marker.
 *
 * <p>Read state is a single sequence number per participant: every message with a sequence
 * number up to {@link #lastReadSequence} counts as read. Marking a conversation read is
 * therefore one row update regardless of how many messages it holds.
 */
@Entity
@Table(name = "conversation_participant",
        uniqueConstraints = @UniqueConstraint(name = "uk_participant_conversation_user",
                columnNames = {"conversation_id", "user_id"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ConversationParticipant {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false)
    private Conversation conversation;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private ActorRole role;

    @Column(name = "last_read_sequence", nullable = false)
    private long lastReadSequence;

    @Column(name = "joined_at", nullable = false)
    private LocalDateTime joinedAt;
}

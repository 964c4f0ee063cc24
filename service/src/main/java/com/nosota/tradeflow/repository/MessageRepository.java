package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.model.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MessageRepository extends JpaRepository<Message, UUID> {

    /**
     * Messages after a sequence number in ascending order. With {@code afterSequence = 0} this
     * is the full history; clients pass their last seen sequence to backfill after reconnecting.
     *
     * @param conversationId Conversation ID
     * @param afterSequence  Exclusive lower bound
     * @param pageable       Limit (first page only)
     * @return Messages ordered by sequence number
     */
    @Query("""
            SELECT m
            FROM Message m
            WHERE m.conversation.id = :conversationId
              AND m.sequenceNumber > :afterSequence
            ORDER BY m.sequenceNumber ASC
            """)
    List<Message> findAfterSequence(@Param("conversationId") UUID conversationId,
                                    @Param("afterSequence") long afterSequence,
                                    Pageable pageable);

    long countByConversationId(UUID conversationId);
}

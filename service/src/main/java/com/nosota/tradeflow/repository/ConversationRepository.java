package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.api.model.ConversationStatus;
import com.nosota.tradeflow.api.model.ConversationType;
import com.nosota.tradeflow.model.Conversation;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

    /**
     * Loads a conversation with a row lock. Appending a message and superseding quotes both
     * serialize on this lock.
     *
     * @param id Conversation ID
     * @return Optional containing the locked conversation
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Conversation c WHERE c.id = :id")
    Optional<Conversation> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Finds open pre-purchase conversations of a buyer about one product or service, most
     * recent first. Used to reuse a thread instead of opening a duplicate.
     */
    @Query("""
            SELECT c
            FROM Conversation c
            WHERE c.buyerId = :buyerId
              AND c.sellerId = :sellerId
              AND c.type = :type
              AND c.status IN :statuses
              AND ((:productId IS NULL AND c.productId IS NULL) OR c.productId = :productId)
              AND ((:serviceId IS NULL AND c.serviceId IS NULL) OR c.serviceId = :serviceId)
            ORDER BY c.createdAt DESC
            """)
    List<Conversation> findReusable(@Param("buyerId") Long buyerId,
                                    @Param("sellerId") Long sellerId,
                                    @Param("type") ConversationType type,
                                    @Param("productId") UUID productId,
                                    @Param("serviceId") UUID serviceId,
                                    @Param("statuses") Collection<ConversationStatus> statuses);

    Optional<Conversation> findFirstByOrderIdOrderByCreatedAtAsc(UUID orderId);

    Optional<Conversation> findFirstByBookingIdOrderByCreatedAtAsc(UUID bookingId);

    /**
     * Conversations the user takes part in, whatever the role, most recently active first.
     */
    @Query(value = """
            SELECT c
            FROM Conversation c
            WHERE c.buyerId = :userId
               OR c.sellerId = :userId
               OR EXISTS (SELECT p FROM ConversationParticipant p WHERE p.conversation = c AND p.userId = :userId)
            ORDER BY COALESCE(c.lastMessageAt, c.createdAt) DESC
            """,
            countQuery = """
            SELECT COUNT(c)
            FROM Conversation c
            WHERE c.buyerId = :userId
               OR c.sellerId = :userId
               OR EXISTS (SELECT p FROM ConversationParticipant p WHERE p.conversation = c AND p.userId = :userId)
            """)
    Page<Conversation> findByMember(@Param("userId") Long userId, Pageable pageable);

    @Query("SELECT c FROM Conversation c ORDER BY COALESCE(c.lastMessageAt, c.createdAt) DESC")
    Page<Conversation> findAllByActivity(Pageable pageable);
}

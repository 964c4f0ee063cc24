package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.model.DesignApproval;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DesignApprovalRepository extends JpaRepository<DesignApproval, UUID> {

    List<DesignApproval> findByConversationIdOrderByCreatedAtAsc(UUID conversationId);

    /**
     * Submissions for one item of a conversation, newest first.
     */
    @Query("""
            SELECT d
            FROM DesignApproval d
            WHERE d.conversationId = :conversationId
              AND ((:productId IS NULL AND d.productId IS NULL) OR d.productId = :productId)
              AND ((:serviceId IS NULL AND d.serviceId IS NULL) OR d.serviceId = :serviceId)
            ORDER BY d.createdAt DESC
            """)
    List<DesignApproval> findForItem(@Param("conversationId") UUID conversationId,
                                     @Param("productId") UUID productId,
                                     @Param("serviceId") UUID serviceId);
}

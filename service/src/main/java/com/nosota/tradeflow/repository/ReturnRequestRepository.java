package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.api.model.ReturnRequestStatus;
import com.nosota.tradeflow.model.ReturnRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReturnRequestRepository extends JpaRepository<ReturnRequest, UUID> {

    List<ReturnRequest> findByOrderIdOrderByAttemptNumberAsc(UUID orderId);

    List<ReturnRequest> findByBookingIdOrderByAttemptNumberAsc(UUID bookingId);

    Optional<ReturnRequest> findFirstByOrderIdOrderByAttemptNumberDesc(UUID orderId);

    Optional<ReturnRequest> findFirstByBookingIdOrderByAttemptNumberDesc(UUID bookingId);

    /**
     * Total already refunded on an order or booking.
     *
     * @param parentId Order or booking ID
     * @return Sum of approved amounts of refunded attempts, zero if none
     */
    @Query("""
            SELECT COALESCE(SUM(r.approvedRefundAmount), 0)
            FROM ReturnRequest r
            WHERE (r.orderId = :parentId OR r.bookingId = :parentId)
              AND r.status = :status
            """)
    BigDecimal sumApprovedRefunds(@Param("parentId") UUID parentId, @Param("status") ReturnRequestStatus status);

    default BigDecimal totalRefunded(UUID parentId) {
        return sumApprovedRefunds(parentId, ReturnRequestStatus.REFUNDED);
    }
}

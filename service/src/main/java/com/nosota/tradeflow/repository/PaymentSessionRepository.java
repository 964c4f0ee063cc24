package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.model.PaymentSession;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentSessionRepository extends JpaRepository<PaymentSession, UUID> {

    /**
     * Loads a session with a row lock so that duplicate gateway callbacks settle it once.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM PaymentSession s WHERE s.id = :id")
    Optional<PaymentSession> findByIdForUpdate(@Param("id") UUID id);
}

package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.model.BoostPurchase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface BoostPurchaseRepository extends JpaRepository<BoostPurchase, UUID> {
}

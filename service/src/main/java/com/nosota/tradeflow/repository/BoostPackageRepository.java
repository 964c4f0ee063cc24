package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.model.BoostPackage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BoostPackageRepository extends JpaRepository<BoostPackage, UUID> {

    List<BoostPackage> findByActiveTrueOrderByPriceAsc();
}

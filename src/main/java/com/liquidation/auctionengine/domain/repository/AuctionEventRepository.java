package com.liquidation.auctionengine.domain.repository;

import com.liquidation.auctionengine.domain.model.AuctionEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuctionEventRepository extends JpaRepository<AuctionEventRecord, Long> {

    List<AuctionEventRecord> findByVaultIdOrderByIdAsc(String vaultId);
}

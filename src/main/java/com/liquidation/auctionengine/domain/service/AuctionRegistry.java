package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.model.AuctionRecord;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class AuctionRegistry {

    private final Map<String, AuctionRecord> auctions = new ConcurrentHashMap<>();

    public Optional<AuctionRecord> find(String vaultId) {
        if (vaultId == null) return Optional.empty();
        return Optional.ofNullable(auctions.get(vaultId));
    }

    public boolean contains(String vaultId) {
        return vaultId != null && auctions.containsKey(vaultId);
    }

    public void put(AuctionRecord record) {
        auctions.put(record.getVaultId(), record);
    }

    public void remove(String vaultId) {
        auctions.remove(vaultId);
    }

    public int size() {
        return auctions.size();
    }
}

package com.liquidation.auctionengine.infra.memory;

import com.liquidation.auctionengine.domain.port.CustodyAdapterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryCustodyAdapterRegistry implements CustodyAdapterRegistry {

    private final Map<String, InMemoryCustodyAdapter> adapters = new ConcurrentHashMap<>();

    @Override
    public InMemoryCustodyAdapter forAsset(String assetId) {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("assetId is required");
        }
        return adapters.computeIfAbsent(assetId, InMemoryCustodyAdapter::new);
    }
}

package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.model.MarketKey;
import com.liquidation.auctionengine.domain.model.MarketLine;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class MarketLineRegistry {

    private final Map<MarketKey, MarketLine> lines = new ConcurrentHashMap<>();

    public Optional<MarketLine> find(MarketKey key) {
        return Optional.ofNullable(lines.get(key));
    }

    void put(MarketKey key, MarketLine line) {
        lines.put(key, line);
    }
}

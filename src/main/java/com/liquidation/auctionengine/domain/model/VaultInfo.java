package com.liquidation.auctionengine.domain.model;

public record VaultInfo(String owner, String ilkId, String baseId) {

    public MarketKey marketKey() {
        return MarketKey.of(ilkId, baseId);
    }
}

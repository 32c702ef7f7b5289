package com.liquidation.auctionengine.domain.model;

public record MarketKey(String ilkId, String baseId) {

    public static MarketKey of(String ilkId, String baseId) {
        return new MarketKey(ilkId, baseId);
    }

    @Override
    public String toString() {
        return ilkId + "/" + baseId;
    }
}

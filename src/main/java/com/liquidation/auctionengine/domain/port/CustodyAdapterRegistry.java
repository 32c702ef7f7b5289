package com.liquidation.auctionengine.domain.port;

public interface CustodyAdapterRegistry {

    CustodyAdapter forAsset(String assetId);
}

package com.liquidation.auctionengine.domain.model;

public enum AuctionEventType {

    AUCTION_OPENED,
    AUCTION_CANCELLED,
    AUCTION_ENDED,
    BOUGHT,
    LINE_SET,
    LIMIT_SET,
    PROTECTION_SET;

    public boolean isVaultScoped() {
        return this == AUCTION_OPENED || this == AUCTION_CANCELLED
                || this == AUCTION_ENDED || this == BOUGHT;
    }
}

package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.model.AuctionEvent;

public interface AuctionEventPublisher {

    void publish(AuctionEvent event);
}

package com.liquidation.auctionengine.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class AuctionOutputEventFactory implements EventFactory<AuctionOutputEvent> {

    @Override
    public AuctionOutputEvent newInstance() {
        return new AuctionOutputEvent();
    }
}

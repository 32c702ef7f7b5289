package com.liquidation.auctionengine.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class AuctionCommandEventFactory implements EventFactory<AuctionCommandEvent> {

    @Override
    public AuctionCommandEvent newInstance() {
        return new AuctionCommandEvent();
    }
}

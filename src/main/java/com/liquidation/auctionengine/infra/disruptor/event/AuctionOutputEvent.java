package com.liquidation.auctionengine.infra.disruptor.event;

import com.liquidation.auctionengine.domain.model.AuctionEvent;

public class AuctionOutputEvent {

    private AuctionEvent event;
    private long publishNanoTime;

    public void clear() {
        event = null;
        publishNanoTime = 0L;
    }

    public AuctionEvent getEvent() {
        return event;
    }

    public void setEvent(AuctionEvent event) {
        this.event = event;
    }

    public long getPublishNanoTime() {
        return publishNanoTime;
    }

    public void setPublishNanoTime(long publishNanoTime) {
        this.publishNanoTime = publishNanoTime;
    }

    @Override
    public String toString() {
        return "AuctionOutputEvent{event=" + event + "}";
    }
}

package com.liquidation.auctionengine.infra.disruptor;

import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.RingBuffer;
import com.liquidation.auctionengine.domain.model.AuctionEvent;
import com.liquidation.auctionengine.domain.service.AuctionEventPublisher;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionOutputEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RingBufferAuctionEventPublisher implements AuctionEventPublisher {

    private static final EventTranslatorOneArg<AuctionOutputEvent, AuctionEvent> TRANSLATOR =
            (slot, sequence, event) -> {
                slot.clear();
                slot.setEvent(event);
                slot.setPublishNanoTime(System.nanoTime());
            };

    private final RingBuffer<AuctionOutputEvent> auctionOutputRingBuffer;

    @Override
    public void publish(AuctionEvent event) {
        auctionOutputRingBuffer.publishEvent(TRANSLATOR, event);
    }
}

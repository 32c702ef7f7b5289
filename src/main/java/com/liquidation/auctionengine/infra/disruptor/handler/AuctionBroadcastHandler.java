package com.liquidation.auctionengine.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.liquidation.auctionengine.domain.model.AuctionEvent;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionOutputEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuctionBroadcastHandler implements EventHandler<AuctionOutputEvent> {

    static final String TOPIC = "/topic/auctions";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onEvent(AuctionOutputEvent outputEvent, long sequence, boolean endOfBatch) {
        AuctionEvent event = outputEvent.getEvent();
        if (event == null || event.getType() == null) return;

        messagingTemplate.convertAndSend(TOPIC, event);
        if (event.getType().isVaultScoped() && event.getVaultId() != null) {
            messagingTemplate.convertAndSend(TOPIC + "/" + event.getVaultId(), event);
        }

        log.debug("[Broadcast] {} → {}, vaultId={}, delay={}μs",
                event.getType(), TOPIC, event.getVaultId(),
                (System.nanoTime() - outputEvent.getPublishNanoTime()) / 1_000);
    }
}

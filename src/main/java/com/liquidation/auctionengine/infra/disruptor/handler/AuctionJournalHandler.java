package com.liquidation.auctionengine.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.liquidation.auctionengine.domain.model.AuctionEventRecord;
import com.liquidation.auctionengine.domain.repository.AuctionEventRepository;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionOutputEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuctionJournalHandler implements EventHandler<AuctionOutputEvent> {

    private final AuctionEventRepository auctionEventRepository;

    private final List<AuctionEventRecord> pending = new ArrayList<>();

    @Override
    public void onEvent(AuctionOutputEvent outputEvent, long sequence, boolean endOfBatch) {
        if (outputEvent.getEvent() != null) {
            pending.add(AuctionEventRecord.from(outputEvent.getEvent()));
        }

        if (endOfBatch) {
            flush();
        }
    }

    private void flush() {
        if (pending.isEmpty()) return;

        try {
            auctionEventRepository.saveAll(pending);
            log.debug("[Journal] 배치 flush 완료: events={}", pending.size());
        } catch (Exception e) {
            log.error("[Journal] 이벤트 저장 실패: events={}", pending.size(), e);
        } finally {
            pending.clear();
        }
    }
}

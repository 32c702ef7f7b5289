package com.liquidation.auctionengine.infra.disruptor.monitor;

import com.lmax.disruptor.RingBuffer;
import com.liquidation.auctionengine.domain.service.AuctionRegistry;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionCommandEvent;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionOutputEvent;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class DisruptorMetricsCollector {

    private final RingBuffer<AuctionCommandEvent> commandRingBuffer;
    private final RingBuffer<AuctionOutputEvent> outputRingBuffer;
    private final AuctionRegistry auctionRegistry;
    private final MeterRegistry meterRegistry;

    public DisruptorMetricsCollector(
            RingBuffer<AuctionCommandEvent> auctionCommandRingBuffer,
            RingBuffer<AuctionOutputEvent> auctionOutputRingBuffer,
            AuctionRegistry auctionRegistry,
            MeterRegistry meterRegistry) {
        this.commandRingBuffer = auctionCommandRingBuffer;
        this.outputRingBuffer = auctionOutputRingBuffer;
        this.auctionRegistry = auctionRegistry;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        registerRingBuffer("command", commandRingBuffer);
        registerRingBuffer("output", outputRingBuffer);

        Gauge.builder("auction.active", auctionRegistry, registry -> (double) registry.size())
                .description("Auctions currently open")
                .register(meterRegistry);

        log.info("[Metrics] Disruptor RingBuffer 모니터링 등록 완료");
    }

    @Scheduled(fixedRate = 30_000)
    public void logMetricsSummary() {
        log.info("[Metrics] Command RB: {}% ({}/{}) | Output RB: {}% ({}/{}) | active auctions={}",
                String.format("%.1f", utilization(commandRingBuffer) * 100),
                used(commandRingBuffer), commandRingBuffer.getBufferSize(),
                String.format("%.1f", utilization(outputRingBuffer) * 100),
                used(outputRingBuffer), outputRingBuffer.getBufferSize(),
                auctionRegistry.size());

        Timer e2eTimer = meterRegistry.find("auction.command.e2e_latency").timer();
        if (e2eTimer != null) {
            log.info("[Metrics] Command e2e avg={}μs max={}μs cnt={}",
                    String.format("%.0f", e2eTimer.mean(TimeUnit.MICROSECONDS)),
                    String.format("%.0f", e2eTimer.max(TimeUnit.MICROSECONDS)),
                    e2eTimer.count());
        }
    }

    private void registerRingBuffer(String pipeline, RingBuffer<?> ringBuffer) {
        Gauge.builder("disruptor.ringbuffer.utilization", ringBuffer, DisruptorMetricsCollector::utilization)
                .tag("pipeline", pipeline)
                .description("RingBuffer utilization (0.0~1.0)")
                .register(meterRegistry);

        Gauge.builder("disruptor.ringbuffer.remaining", ringBuffer, rb -> (double) rb.remainingCapacity())
                .tag("pipeline", pipeline)
                .description("RingBuffer remaining capacity")
                .register(meterRegistry);
    }

    private static double utilization(RingBuffer<?> ringBuffer) {
        return 1.0 - ((double) ringBuffer.remainingCapacity() / ringBuffer.getBufferSize());
    }

    private static long used(RingBuffer<?> ringBuffer) {
        return ringBuffer.getBufferSize() - ringBuffer.remainingCapacity();
    }
}

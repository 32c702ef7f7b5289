package com.liquidation.auctionengine.infra.disruptor.config;

import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.liquidation.auctionengine.domain.service.AuctionEngineProperties;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionOutputEvent;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionOutputEventFactory;
import com.liquidation.auctionengine.infra.disruptor.handler.AuctionBroadcastHandler;
import com.liquidation.auctionengine.infra.disruptor.handler.AuctionJournalHandler;
import com.liquidation.auctionengine.infra.disruptor.handler.DisruptorExceptionHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class OutputDisruptorConfig {

    private final AuctionBroadcastHandler auctionBroadcastHandler;
    private final AuctionJournalHandler auctionJournalHandler;
    private final AuctionEngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<AuctionOutputEvent> outputDisruptor;

    @Bean
    public Disruptor<AuctionOutputEvent> auctionOutputDisruptor() {
        int bufferSize = properties.getPipeline().getEventBufferSize();
        WaitStrategy waitStrategy = DisruptorConfig.resolveWaitStrategy(environment);

        outputDisruptor = new Disruptor<>(
                new AuctionOutputEventFactory(),
                bufferSize,
                DisruptorConfig.namedThreadFactory("disruptor-output"),
                ProducerType.MULTI,
                waitStrategy
        );

        outputDisruptor.setDefaultExceptionHandler(
                new DisruptorExceptionHandler<>("output", meterRegistry));

        outputDisruptor.handleEventsWith(auctionBroadcastHandler, auctionJournalHandler);
        outputDisruptor.start();

        log.info("[Disruptor] Output 파이프라인 기동: AuctionEvent → (STOMP Broadcast || Journal) | size={}, wait={}",
                bufferSize, waitStrategy.getClass().getSimpleName());

        return outputDisruptor;
    }

    @Bean
    public RingBuffer<AuctionOutputEvent> auctionOutputRingBuffer(
            Disruptor<AuctionOutputEvent> auctionOutputDisruptor) {
        return auctionOutputDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (outputDisruptor != null) {
            outputDisruptor.shutdown();
            log.info("[Disruptor] Output Disruptor 종료 완료");
        }
    }
}

package com.liquidation.auctionengine.infra.disruptor.config;

import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.liquidation.auctionengine.domain.service.AuctionEngineProperties;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionCommandEvent;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionCommandEventFactory;
import com.liquidation.auctionengine.infra.disruptor.handler.AuctionCommandHandler;
import com.liquidation.auctionengine.infra.disruptor.handler.DisruptorExceptionHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Arrays;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class DisruptorConfig {

    private final AuctionCommandHandler auctionCommandHandler;
    private final AuctionEngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<AuctionCommandEvent> commandDisruptor;

    @Bean
    public Disruptor<AuctionCommandEvent> auctionCommandDisruptor() {
        int bufferSize = properties.getPipeline().getCommandBufferSize();
        WaitStrategy waitStrategy = resolveWaitStrategy(environment);

        commandDisruptor = new Disruptor<>(
                new AuctionCommandEventFactory(),
                bufferSize,
                namedThreadFactory("disruptor-command"),
                ProducerType.MULTI,
                waitStrategy
        );

        commandDisruptor.setDefaultExceptionHandler(
                new DisruptorExceptionHandler<>("command", meterRegistry));

        commandDisruptor.handleEventsWith(auctionCommandHandler);
        commandDisruptor.start();

        log.info("[Disruptor] Command 파이프라인 기동: REST → AuctionCommand | size={}, wait={}",
                bufferSize, waitStrategy.getClass().getSimpleName());

        return commandDisruptor;
    }

    @Bean
    public RingBuffer<AuctionCommandEvent> auctionCommandRingBuffer(
            Disruptor<AuctionCommandEvent> auctionCommandDisruptor) {
        return auctionCommandDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Disruptor] 종료 시작...");
        if (commandDisruptor != null) {
            commandDisruptor.shutdown();
            log.info("[Disruptor] Command Disruptor 종료 완료");
        }
    }

    static WaitStrategy resolveWaitStrategy(Environment environment) {
        if (Arrays.asList(environment.getActiveProfiles()).contains("prod")) {
            log.info("[Disruptor] prod 프로파일 → YieldingWaitStrategy (저지연)");
            return new YieldingWaitStrategy();
        }
        log.info("[Disruptor] dev/local 프로파일 → SleepingWaitStrategy (저CPU)");
        return new SleepingWaitStrategy();
    }

    static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

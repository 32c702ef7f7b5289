package com.liquidation.auctionengine.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import com.liquidation.auctionengine.domain.service.AuctionAdminService;
import com.liquidation.auctionengine.domain.service.AuctionLifecycleService;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionCommandEvent;
import com.liquidation.auctionengine.infra.disruptor.event.CommandType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuctionCommandHandler implements EventHandler<AuctionCommandEvent> {

    private final AuctionLifecycleService lifecycleService;
    private final AuctionAdminService adminService;
    private final MeterRegistry meterRegistry;

    @Override
    public void onEvent(AuctionCommandEvent event, long sequence, boolean endOfBatch) {
        CompletableFuture<Object> result = event.getResult();
        CommandType type = event.getType();
        if (type == null || result == null) return;

        long startNano = System.nanoTime();
        String outcome = "success";
        try {
            result.complete(execute(event));
        } catch (AuctionException e) {
            outcome = "rejected";
            Counter.builder("auction.command.rejected")
                    .tag("type", type.name())
                    .tag("error", e.getError().name())
                    .description("Commands rejected by an engine rule")
                    .register(meterRegistry)
                    .increment();
            log.warn("[Command] 거부: type={}, caller={}, vaultId={}, error={}, message={}",
                    type, event.getCaller(), event.getVaultId(), e.getError(), e.getMessage());
            result.completeExceptionally(e);
        } catch (RuntimeException e) {
            outcome = "failed";
            log.error("[Command] 처리 실패: {}", event, e);
            result.completeExceptionally(e);
        } finally {
            long endNano = System.nanoTime();
            Timer.builder("auction.command.duration")
                    .tag("type", type.name())
                    .tag("outcome", outcome)
                    .description("Command execution time on the engine thread")
                    .register(meterRegistry)
                    .record(endNano - startNano, TimeUnit.NANOSECONDS);
            if (event.getEnqueueNanoTime() > 0) {
                Timer.builder("auction.command.e2e_latency")
                        .description("Command latency from enqueue to completion")
                        .register(meterRegistry)
                        .record(endNano - event.getEnqueueNanoTime(), TimeUnit.NANOSECONDS);
            }
            event.clear();
        }
    }

    private Object execute(AuctionCommandEvent event) {
        return switch (event.getType()) {
            case OPEN -> lifecycleService.open(event.getVaultId());
            case CANCEL -> {
                lifecycleService.cancel(event.getVaultId());
                yield event.getVaultId();
            }
            case SETTLE_WITH_ASSET -> lifecycleService.settleWithAsset(
                    event.getCaller(), event.getVaultId(), event.getAccount(),
                    event.getMinInkOut(), event.getMaxIn());
            case SETTLE_WITH_DEBT_TOKEN -> lifecycleService.settleWithDebtToken(
                    event.getCaller(), event.getVaultId(), event.getAccount(),
                    event.getMinInkOut(), event.getMaxIn());
            case SET_LINE -> adminService.setLine(
                    event.getCaller(), event.getIlkId(), event.getBaseId(),
                    event.getDuration(), event.getInitialOffer(), event.getProportion());
            case SET_LIMIT -> adminService.setLimit(
                    event.getCaller(), event.getIlkId(), event.getBaseId(), event.getMaxIn());
            case SET_PROTECTED -> {
                adminService.setProtected(event.getCaller(), event.getAccount(), event.isFlag());
                yield event.isFlag();
            }
            case GRANT_ROLE -> {
                adminService.grantRole(event.getCaller(), event.getRole(), event.getAccount());
                yield event.getAccount();
            }
            case REVOKE_ROLE -> {
                adminService.revokeRole(event.getCaller(), event.getRole(), event.getAccount());
                yield event.getAccount();
            }
        };
    }
}

package com.liquidation.auctionengine.infra.disruptor;

import com.lmax.disruptor.RingBuffer;
import com.liquidation.auctionengine.domain.model.AuctionRecord;
import com.liquidation.auctionengine.domain.model.ExposureLimit;
import com.liquidation.auctionengine.domain.model.MarketLine;
import com.liquidation.auctionengine.domain.model.SettlementResult;
import com.liquidation.auctionengine.domain.service.AuctionEngineProperties;
import com.liquidation.auctionengine.infra.disruptor.event.AuctionCommandEvent;
import com.liquidation.auctionengine.infra.disruptor.event.CommandType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

@Slf4j
@Component
public class AuctionCommandGateway {

    private final RingBuffer<AuctionCommandEvent> ringBuffer;
    private final long timeoutMs;

    public AuctionCommandGateway(RingBuffer<AuctionCommandEvent> auctionCommandRingBuffer,
                                 AuctionEngineProperties properties) {
        this.ringBuffer = auctionCommandRingBuffer;
        this.timeoutMs = properties.getPipeline().getCommandTimeoutMs();
    }

    public CompletableFuture<AuctionRecord> open(String vaultId) {
        return submit(CommandType.OPEN, event -> event.setVaultId(vaultId));
    }

    public CompletableFuture<String> cancel(String vaultId) {
        return submit(CommandType.CANCEL, event -> event.setVaultId(vaultId));
    }

    public CompletableFuture<SettlementResult> settleWithAsset(String buyer, String vaultId, String receiver,
                                                               BigInteger minInkOut, BigInteger maxAssetIn) {
        return submit(CommandType.SETTLE_WITH_ASSET, event -> {
            event.setCaller(buyer);
            event.setVaultId(vaultId);
            event.setAccount(receiver);
            event.setMinInkOut(minInkOut);
            event.setMaxIn(maxAssetIn);
        });
    }

    public CompletableFuture<SettlementResult> settleWithDebtToken(String buyer, String vaultId, String receiver,
                                                                   BigInteger minInkOut, BigInteger maxTokenIn) {
        return submit(CommandType.SETTLE_WITH_DEBT_TOKEN, event -> {
            event.setCaller(buyer);
            event.setVaultId(vaultId);
            event.setAccount(receiver);
            event.setMinInkOut(minInkOut);
            event.setMaxIn(maxTokenIn);
        });
    }

    public CompletableFuture<MarketLine> setLine(String caller, String ilkId, String baseId,
                                                 long duration, BigInteger initialOffer, BigInteger proportion) {
        return submit(CommandType.SET_LINE, event -> {
            event.setCaller(caller);
            event.setIlkId(ilkId);
            event.setBaseId(baseId);
            event.setDuration(duration);
            event.setInitialOffer(initialOffer);
            event.setProportion(proportion);
        });
    }

    public CompletableFuture<ExposureLimit> setLimit(String caller, String ilkId, String baseId, BigInteger max) {
        return submit(CommandType.SET_LIMIT, event -> {
            event.setCaller(caller);
            event.setIlkId(ilkId);
            event.setBaseId(baseId);
            event.setMaxIn(max);
        });
    }

    public CompletableFuture<Boolean> setProtected(String caller, String owner, boolean isProtected) {
        return submit(CommandType.SET_PROTECTED, event -> {
            event.setCaller(caller);
            event.setAccount(owner);
            event.setFlag(isProtected);
        });
    }

    public CompletableFuture<String> grantRole(String caller, String role, String account) {
        return submit(CommandType.GRANT_ROLE, event -> {
            event.setCaller(caller);
            event.setRole(role);
            event.setAccount(account);
        });
    }

    public CompletableFuture<String> revokeRole(String caller, String role, String account) {
        return submit(CommandType.REVOKE_ROLE, event -> {
            event.setCaller(caller);
            event.setRole(role);
            event.setAccount(account);
        });
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> submit(CommandType type, Consumer<AuctionCommandEvent> fill) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        ringBuffer.publishEvent((event, sequence) -> {
            event.clear();
            event.setType(type);
            fill.accept(event);
            event.setResult(result);
            event.setEnqueueNanoTime(System.nanoTime());
        });
        log.debug("[Gateway] 커맨드 발행: type={}", type);
        return (CompletableFuture<T>) (CompletableFuture<?>) result.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }
}

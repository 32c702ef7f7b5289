package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import com.liquidation.auctionengine.domain.model.AuctionEvent;
import com.liquidation.auctionengine.domain.model.AuctionEventType;
import com.liquidation.auctionengine.domain.model.AuctionRecord;
import com.liquidation.auctionengine.domain.model.MarketKey;
import com.liquidation.auctionengine.domain.model.MarketLine;
import com.liquidation.auctionengine.domain.model.SettlementResult;
import com.liquidation.auctionengine.domain.model.VaultBalances;
import com.liquidation.auctionengine.domain.model.VaultInfo;
import com.liquidation.auctionengine.domain.port.CustodyAdapter;
import com.liquidation.auctionengine.domain.port.CustodyAdapterRegistry;
import com.liquidation.auctionengine.domain.port.DebtToken;
import com.liquidation.auctionengine.domain.port.VaultLedger;
import com.liquidation.auctionengine.domain.service.pricing.AuctionPricing;
import com.liquidation.auctionengine.domain.service.pricing.WadMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;
import java.util.function.BooleanSupplier;

// Mutating methods run on the command pipeline thread only.
@Slf4j
@Service
@RequiredArgsConstructor
public class AuctionLifecycleService {

    private final VaultLedger vaultLedger;
    private final CustodyAdapterRegistry custodyAdapters;
    private final DebtToken debtToken;
    private final AuctionRegistry auctionRegistry;
    private final MarketLineRegistry marketLineRegistry;
    private final ExposureLimiter exposureLimiter;
    private final VaultProtectionRegistry vaultProtectionRegistry;
    private final AuctionPricing auctionPricing;
    private final AuctionEventPublisher eventPublisher;
    private final AuctionEngineProperties properties;
    private final Clock clock;

    public AuctionRecord open(String vaultId) {
        if (auctionRegistry.contains(vaultId)) {
            throw AuctionException.of(AuctionError.VAULT_ALREADY_AUCTIONED, "vaultId=%s", vaultId);
        }

        VaultInfo vault = vaultLedger.vault(vaultId);
        if (vaultProtectionRegistry.isProtected(vault.owner())) {
            throw AuctionException.of(AuctionError.VAULT_PROTECTED, "vaultId=%s, owner=%s", vaultId, vault.owner());
        }
        MarketKey key = vault.marketKey();
        MarketLine line = requireLine(key);
        if (!vaultLedger.isUndercollateralized(vaultId)) {
            throw AuctionException.of(AuctionError.NOT_UNDERCOLLATERALIZED, "vaultId=%s", vaultId);
        }

        VaultBalances balances = vaultLedger.balances(vaultId);
        BigInteger dust = vaultLedger.debtLimits(vault.baseId(), vault.ilkId()).dust();

        BigInteger art = WadMath.wmul(balances.art(), line.proportion());
        BigInteger ink = WadMath.wmul(balances.ink(), line.proportion());
        if (WadMath.sub(balances.art(), art).compareTo(dust) < 0) {
            art = balances.art();
            ink = balances.ink();
        }

        exposureLimiter.reserve(key, ink);
        try {
            vaultLedger.transferVaultCustody(vaultId, properties.getEngineAccount());
        } catch (RuntimeException e) {
            exposureLimiter.release(key, ink);
            throw e;
        }

        AuctionRecord record = AuctionRecord.builder()
                .vaultId(vaultId)
                .owner(vault.owner())
                .start(now())
                .ilkId(vault.ilkId())
                .debtAssetId(vault.baseId())
                .art(art)
                .ink(ink)
                .build();
        auctionRegistry.put(record);

        log.info("[Auction] 경매 시작: vaultId={}, market={}, owner={}, art={}, ink={}, start={}",
                vaultId, key, vault.owner(), art, ink, record.getStart());

        eventPublisher.publish(vaultEvent(AuctionEventType.AUCTION_OPENED, record)
                .account(vault.owner())
                .art(art)
                .ink(ink)
                .timestamp(record.getStart())
                .build());
        return record;
    }

    public void cancel(String vaultId) {
        AuctionRecord record = requireAuction(vaultId);
        if (vaultLedger.isUndercollateralized(vaultId)) {
            throw AuctionException.of(AuctionError.STILL_UNDERCOLLATERALIZED, "vaultId=%s", vaultId);
        }

        vaultLedger.transferVaultCustody(vaultId, record.getOwner());
        exposureLimiter.release(record.marketKey(), record.getInk());
        auctionRegistry.remove(vaultId);

        log.info("[Auction] 경매 취소: vaultId={}, owner={}, releasedInk={}",
                vaultId, record.getOwner(), record.getInk());

        eventPublisher.publish(vaultEvent(AuctionEventType.AUCTION_CANCELLED, record)
                .account(record.getOwner())
                .ink(record.getInk())
                .art(record.getArt())
                .build());
    }

    public SettlementResult settleWithAsset(String buyer, String vaultId, String receiver,
                                            BigInteger minInkOut, BigInteger maxAssetIn) {
        AuctionRecord record = requireAuction(vaultId);
        String baseId = record.getDebtAssetId();

        BigInteger artIn = WadMath.min(
                vaultLedger.convertDebtAssetToDebtTokenUnits(baseId, maxAssetIn), record.getArt());
        artIn = avoidDust(record, artIn, () ->
                vaultLedger.convertDebtTokenUnitsToDebtAsset(baseId, record.getArt()).compareTo(maxAssetIn) <= 0);

        BigInteger inkOut = requireEnoughBought(record, artIn, minInkOut);
        BigInteger assetIn = vaultLedger.convertDebtTokenUnitsToDebtAsset(baseId, artIn);

        CustodyAdapter baseCustody = custodyAdapters.forAsset(baseId);
        CustodyAdapter collateralCustody = custodyAdapters.forAsset(record.getIlkId());
        requireDeliverable(record, artIn, inkOut, collateralCustody);
        baseCustody.receiveFrom(buyer, assetIn);

        return applySettlement(buyer, receiver, record, artIn, inkOut, assetIn, collateralCustody);
    }

    public SettlementResult settleWithDebtToken(String buyer, String vaultId, String receiver,
                                                BigInteger minInkOut, BigInteger maxTokenIn) {
        AuctionRecord record = requireAuction(vaultId);

        BigInteger artIn = WadMath.min(maxTokenIn, record.getArt());
        artIn = avoidDust(record, artIn, () -> record.getArt().compareTo(maxTokenIn) <= 0);

        BigInteger inkOut = requireEnoughBought(record, artIn, minInkOut);

        CustodyAdapter collateralCustody = custodyAdapters.forAsset(record.getIlkId());
        requireDeliverable(record, artIn, inkOut, collateralCustody);
        debtToken.burn(record.getDebtAssetId(), buyer, artIn);

        return applySettlement(buyer, receiver, record, artIn, inkOut, artIn, collateralCustody);
    }

    public BigInteger quotePayout(String vaultId, BigInteger artIn) {
        AuctionRecord record = requireAuction(vaultId);
        return payoutNow(record, WadMath.min(artIn, record.getArt()));
    }

    public Optional<AuctionRecord> auction(String vaultId) {
        return auctionRegistry.find(vaultId);
    }

    private SettlementResult applySettlement(String buyer, String receiver, AuctionRecord record,
                                             BigInteger artIn, BigInteger inkOut, BigInteger amountIn,
                                             CustodyAdapter collateralCustody) {
        String vaultId = record.getVaultId();
        MarketKey key = record.marketKey();

        vaultLedger.reduceBalances(vaultId, inkOut, artIn);
        if (inkOut.signum() > 0) {
            collateralCustody.releaseTo(receiver, inkOut);
        }

        boolean completed = artIn.equals(record.getArt());
        if (completed) {
            exposureLimiter.release(key, record.getInk());
            vaultLedger.transferVaultCustody(vaultId, record.getOwner());
            auctionRegistry.remove(vaultId);
        } else {
            exposureLimiter.release(key, inkOut);
            auctionRegistry.put(record.reducedBy(artIn, inkOut));
        }

        log.info("[Auction] 매수 체결: vaultId={}, buyer={}, receiver={}, artIn={}, inkOut={}, paid={}, completed={}",
                vaultId, buyer, receiver, artIn, inkOut, amountIn, completed);

        long timestamp = now();
        eventPublisher.publish(vaultEvent(AuctionEventType.BOUGHT, record)
                .account(buyer)
                .ink(inkOut)
                .art(artIn)
                .amount(amountIn)
                .timestamp(timestamp)
                .build());
        if (completed) {
            eventPublisher.publish(vaultEvent(AuctionEventType.AUCTION_ENDED, record)
                    .account(record.getOwner())
                    .timestamp(timestamp)
                    .build());
        }
        return new SettlementResult(inkOut, amountIn, artIn, completed);
    }

    // a fill leaving a remainder below dust is widened to the whole remainder if the buyer's limit covers it
    private BigInteger avoidDust(AuctionRecord record, BigInteger artIn, BooleanSupplier coversRemainder) {
        BigInteger remainder = WadMath.sub(record.getArt(), artIn);
        if (remainder.signum() == 0) {
            return artIn;
        }
        BigInteger dust = vaultLedger.debtLimits(record.getDebtAssetId(), record.getIlkId()).dust();
        if (remainder.compareTo(dust) >= 0) {
            return artIn;
        }
        if (coversRemainder.getAsBoolean()) {
            log.debug("[Auction] dust 회피를 위해 전량 체결로 확장: vaultId={}, artIn={} -> {}",
                    record.getVaultId(), artIn, record.getArt());
            return record.getArt();
        }
        throw AuctionException.of(AuctionError.LEAVES_DUST,
                "vaultId=%s, remainder=%s, dust=%s", record.getVaultId(), remainder, dust);
    }

    // nothing after the buyer's payment may fail
    private void requireDeliverable(AuctionRecord record, BigInteger artIn, BigInteger inkOut,
                                    CustodyAdapter collateralCustody) {
        VaultBalances balances = vaultLedger.balances(record.getVaultId());
        if (balances.ink().compareTo(inkOut) < 0 || balances.art().compareTo(artIn) < 0) {
            throw new IllegalStateException(String.format(
                    "Vault balances cannot cover settlement: vaultId=%s, ink=%s, art=%s, inkOut=%s, artIn=%s",
                    record.getVaultId(), balances.ink(), balances.art(), inkOut, artIn));
        }
        if (!collateralCustody.canRelease(inkOut)) {
            throw new IllegalStateException(String.format(
                    "Collateral custody cannot release payout: vaultId=%s, asset=%s, inkOut=%s",
                    record.getVaultId(), collateralCustody.assetId(), inkOut));
        }
    }

    private BigInteger requireEnoughBought(AuctionRecord record, BigInteger artIn, BigInteger minInkOut) {
        BigInteger inkOut = payoutNow(record, artIn);
        if (inkOut.compareTo(minInkOut) < 0) {
            throw AuctionException.of(AuctionError.NOT_ENOUGH_BOUGHT,
                    "vaultId=%s, inkOut=%s, minInkOut=%s", record.getVaultId(), inkOut, minInkOut);
        }
        return inkOut;
    }

    private BigInteger payoutNow(AuctionRecord record, BigInteger artIn) {
        MarketLine line = requireLine(record.marketKey());
        return auctionPricing.payoutAt(record, line, artIn, now());
    }

    private AuctionRecord requireAuction(String vaultId) {
        return auctionRegistry.find(vaultId)
                .orElseThrow(() -> AuctionException.of(AuctionError.VAULT_NOT_AUCTIONED, "vaultId=%s", vaultId));
    }

    private MarketLine requireLine(MarketKey key) {
        return marketLineRegistry.find(key)
                .orElseThrow(() -> AuctionException.of(AuctionError.MARKET_NOT_CONFIGURED, "market=%s", key));
    }

    private AuctionEvent.AuctionEventBuilder vaultEvent(AuctionEventType type, AuctionRecord record) {
        return AuctionEvent.builder()
                .type(type)
                .vaultId(record.getVaultId())
                .ilkId(record.getIlkId())
                .baseId(record.getDebtAssetId())
                .timestamp(now());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

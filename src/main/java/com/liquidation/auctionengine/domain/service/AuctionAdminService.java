package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import com.liquidation.auctionengine.domain.model.AuctionEvent;
import com.liquidation.auctionengine.domain.model.AuctionEventType;
import com.liquidation.auctionengine.domain.model.ExposureLimit;
import com.liquidation.auctionengine.domain.model.MarketKey;
import com.liquidation.auctionengine.domain.model.MarketLine;
import com.liquidation.auctionengine.domain.service.pricing.WadMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuctionAdminService {

    static final BigInteger MIN_FRACTION = BigInteger.TEN.pow(16);

    private final AccessControl accessControl;
    private final MarketLineRegistry marketLineRegistry;
    private final ExposureLimiter exposureLimiter;
    private final VaultProtectionRegistry vaultProtectionRegistry;
    private final AuctionEventPublisher eventPublisher;
    private final Clock clock;

    public MarketLine setLine(String caller, String ilkId, String baseId,
                              long duration, BigInteger initialOffer, BigInteger proportion) {
        accessControl.requireRole(AccessControl.ADMIN_ROLE, caller);
        MarketLine line = installLine(MarketKey.of(ilkId, baseId), duration, initialOffer, proportion);

        eventPublisher.publish(AuctionEvent.builder()
                .type(AuctionEventType.LINE_SET)
                .ilkId(ilkId)
                .baseId(baseId)
                .account(caller)
                .detail("duration=" + duration + ", initialOffer=" + initialOffer + ", proportion=" + proportion)
                .timestamp(now())
                .build());
        return line;
    }

    public ExposureLimit setLimit(String caller, String ilkId, String baseId, BigInteger max) {
        accessControl.requireRole(AccessControl.ADMIN_ROLE, caller);
        if (max == null || max.signum() < 0 || max.compareTo(WadMath.MAX_U128) > 0) {
            throw AuctionException.of(AuctionError.INVALID_PARAMETER, "max=%s", max);
        }
        ExposureLimit limit = exposureLimiter.setMax(MarketKey.of(ilkId, baseId), max);

        eventPublisher.publish(AuctionEvent.builder()
                .type(AuctionEventType.LIMIT_SET)
                .ilkId(ilkId)
                .baseId(baseId)
                .account(caller)
                .amount(max)
                .timestamp(now())
                .build());
        return limit;
    }

    public void setProtected(String caller, String owner, boolean isProtected) {
        accessControl.requireRole(AccessControl.ADMIN_ROLE, caller);
        if (owner == null || owner.isBlank()) {
            throw AuctionException.of(AuctionError.INVALID_PARAMETER, "owner is required");
        }
        vaultProtectionRegistry.setProtected(owner, isProtected);
        log.info("[Admin] 보호 계정 설정: owner={}, protected={}", owner, isProtected);

        eventPublisher.publish(AuctionEvent.builder()
                .type(AuctionEventType.PROTECTION_SET)
                .account(owner)
                .detail(String.valueOf(isProtected))
                .timestamp(now())
                .build());
    }

    public void grantRole(String caller, String role, String account) {
        accessControl.requireRole(AccessControl.ADMIN_ROLE, caller);
        if (role == null || role.isBlank() || account == null || account.isBlank()) {
            throw AuctionException.of(AuctionError.INVALID_PARAMETER, "role=%s, account=%s", role, account);
        }
        accessControl.grant(role, account);
    }

    public void revokeRole(String caller, String role, String account) {
        accessControl.requireRole(AccessControl.ADMIN_ROLE, caller);
        accessControl.revoke(role, account);
    }

    MarketLine installLine(MarketKey key, long duration, BigInteger initialOffer, BigInteger proportion) {
        if (duration <= 0) {
            throw AuctionException.of(AuctionError.INVALID_PARAMETER, "duration=%d", duration);
        }
        if (!isFraction(initialOffer)) {
            throw AuctionException.of(AuctionError.INVALID_PARAMETER, "initialOffer=%s", initialOffer);
        }
        if (!isFraction(proportion)) {
            throw AuctionException.of(AuctionError.INVALID_PARAMETER, "proportion=%s", proportion);
        }
        MarketLine line = new MarketLine(duration, initialOffer, proportion);
        marketLineRegistry.put(key, line);
        log.info("[Admin] 경매 라인 설정: market={}, duration={}s, initialOffer={}, proportion={}",
                key, duration, initialOffer, proportion);
        return line;
    }

    private static boolean isFraction(BigInteger value) {
        return value != null
                && value.compareTo(MIN_FRACTION) >= 0
                && value.compareTo(WadMath.WAD) <= 0;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

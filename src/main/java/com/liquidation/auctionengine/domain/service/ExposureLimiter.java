package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import com.liquidation.auctionengine.domain.model.ExposureLimit;
import com.liquidation.auctionengine.domain.model.MarketKey;
import com.liquidation.auctionengine.domain.service.pricing.WadMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Soft cap on collateral under auction per market. A reservation is refused only once
 * the running sum has reached the cap; an accepted reservation may push the sum past it.
 */
@Slf4j
@Component
public class ExposureLimiter {

    private final Map<MarketKey, ExposureLimit> limits = new ConcurrentHashMap<>();

    public void reserve(MarketKey key, BigInteger ink) {
        limits.compute(key, (k, current) -> {
            ExposureLimit limit = current != null ? current : ExposureLimit.EMPTY;
            if (limit.isAtCap()) {
                throw AuctionException.of(AuctionError.EXPOSURE_EXCEEDED,
                        "market=%s, sum=%s, max=%s", k, limit.sum(), limit.max());
            }
            return limit.withSum(WadMath.add(limit.sum(), ink));
        });
        log.debug("[Exposure] reserve: market={}, ink={}", key, ink);
    }

    public void release(MarketKey key, BigInteger ink) {
        limits.compute(key, (k, current) -> {
            ExposureLimit limit = current != null ? current : ExposureLimit.EMPTY;
            return limit.withSum(WadMath.sub(limit.sum(), ink));
        });
        log.debug("[Exposure] release: market={}, ink={}", key, ink);
    }

    public ExposureLimit setMax(MarketKey key, BigInteger max) {
        ExposureLimit updated = limits.compute(key, (k, current) ->
                (current != null ? current : ExposureLimit.EMPTY).withMax(WadMath.u128(max)));
        log.info("[Exposure] 한도 설정: market={}, max={}, sum={}", key, updated.max(), updated.sum());
        return updated;
    }

    public ExposureLimit limit(MarketKey key) {
        return limits.getOrDefault(key, ExposureLimit.EMPTY);
    }
}

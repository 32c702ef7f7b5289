package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import com.liquidation.auctionengine.domain.model.MarketKey;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExposureLimiterTest {

    private static final MarketKey MARKET = MarketKey.of("ETH", "USDC");

    private final ExposureLimiter limiter = new ExposureLimiter();

    @Test
    void unconfiguredMarketRejectsReservation() {
        assertThatThrownBy(() -> limiter.reserve(MARKET, BigInteger.ONE))
                .isInstanceOf(AuctionException.class)
                .satisfies(e -> assertThat(((AuctionException) e).getError()).isEqualTo(AuctionError.EXPOSURE_EXCEEDED));
    }

    @Test
    void reservationBelowCapMayOvershootIt() {
        limiter.setMax(MARKET, BigInteger.valueOf(100));
        limiter.reserve(MARKET, BigInteger.valueOf(99));
        limiter.reserve(MARKET, BigInteger.valueOf(50));

        assertThat(limiter.limit(MARKET).sum()).isEqualTo(BigInteger.valueOf(149));
        assertThatThrownBy(() -> limiter.reserve(MARKET, BigInteger.ONE))
                .isInstanceOf(AuctionException.class);
    }

    @Test
    void releaseReopensCapacity() {
        limiter.setMax(MARKET, BigInteger.valueOf(100));
        limiter.reserve(MARKET, BigInteger.valueOf(100));
        limiter.release(MARKET, BigInteger.valueOf(40));

        limiter.reserve(MARKET, BigInteger.valueOf(10));

        assertThat(limiter.limit(MARKET).sum()).isEqualTo(BigInteger.valueOf(70));
    }

    @Test
    void releaseBelowZeroFails() {
        limiter.setMax(MARKET, BigInteger.TEN);
        limiter.reserve(MARKET, BigInteger.ONE);

        assertThatThrownBy(() -> limiter.release(MARKET, BigInteger.TWO))
                .isInstanceOf(ArithmeticException.class);
        assertThat(limiter.limit(MARKET).sum()).isEqualTo(BigInteger.ONE);
    }

    @Test
    void setMaxKeepsRunningSum() {
        limiter.setMax(MARKET, BigInteger.TEN);
        limiter.reserve(MARKET, BigInteger.valueOf(5));

        limiter.setMax(MARKET, BigInteger.valueOf(3));

        assertThat(limiter.limit(MARKET).max()).isEqualTo(BigInteger.valueOf(3));
        assertThat(limiter.limit(MARKET).sum()).isEqualTo(BigInteger.valueOf(5));
        assertThat(limiter.limit(MARKET).isAtCap()).isTrue();
    }
}

package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import com.liquidation.auctionengine.domain.model.AuctionEvent;
import com.liquidation.auctionengine.domain.model.AuctionEventType;
import com.liquidation.auctionengine.domain.model.MarketKey;
import com.liquidation.auctionengine.domain.model.MarketLine;
import com.liquidation.auctionengine.domain.service.pricing.WadMath;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuctionAdminServiceTest {

    private static final String ADMIN = "governance";
    private static final MarketKey MARKET = MarketKey.of("ETH", "USDC");
    private static final BigInteger OFFER = new BigInteger("714000000000000000");
    private static final BigInteger HALF = new BigInteger("500000000000000000");

    @Mock
    private AuctionEventPublisher eventPublisher;

    private AccessControl accessControl;
    private MarketLineRegistry lineRegistry;
    private ExposureLimiter exposureLimiter;
    private VaultProtectionRegistry protectionRegistry;
    private AuctionAdminService adminService;

    @BeforeEach
    void setUp() {
        accessControl = new AccessControl();
        lineRegistry = new MarketLineRegistry();
        exposureLimiter = new ExposureLimiter();
        protectionRegistry = new VaultProtectionRegistry();
        adminService = new AuctionAdminService(accessControl, lineRegistry, exposureLimiter, protectionRegistry,
                eventPublisher, Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
        accessControl.grant(AccessControl.ADMIN_ROLE, ADMIN);
    }

    @Test
    void setLine_storesLineAndPublishesEvent() {
        MarketLine line = adminService.setLine(ADMIN, "ETH", "USDC", 3600, OFFER, HALF);

        assertThat(lineRegistry.find(MARKET)).contains(line);
        ArgumentCaptor<AuctionEvent> captor = ArgumentCaptor.forClass(AuctionEvent.class);
        verify(eventPublisher).publish(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(AuctionEventType.LINE_SET);
        assertThat(captor.getValue().getAccount()).isEqualTo(ADMIN);
        assertThat(captor.getValue().getTimestamp()).isEqualTo(1_700_000_000L);
    }

    @Test
    void setLine_acceptsFractionBounds() {
        adminService.setLine(ADMIN, "ETH", "USDC", 1, AuctionAdminService.MIN_FRACTION, WadMath.WAD);

        assertThat(lineRegistry.find(MARKET)).isPresent();
    }

    @Test
    void setLine_rejectsOutOfRangeParameters() {
        BigInteger belowOnePercent = AuctionAdminService.MIN_FRACTION.subtract(BigInteger.ONE);
        BigInteger aboveOne = WadMath.WAD.add(BigInteger.ONE);

        assertRejected(() -> adminService.setLine(ADMIN, "ETH", "USDC", 3600, belowOnePercent, HALF),
                AuctionError.INVALID_PARAMETER);
        assertRejected(() -> adminService.setLine(ADMIN, "ETH", "USDC", 3600, OFFER, aboveOne),
                AuctionError.INVALID_PARAMETER);
        assertRejected(() -> adminService.setLine(ADMIN, "ETH", "USDC", 0, OFFER, HALF),
                AuctionError.INVALID_PARAMETER);
        assertThat(lineRegistry.find(MARKET)).isEmpty();
        verify(eventPublisher, never()).publish(any());
    }

    @Test
    void everySetterRequiresAdminRole() {
        assertRejected(() -> adminService.setLine("mallory", "ETH", "USDC", 3600, OFFER, HALF),
                AuctionError.UNAUTHORIZED);
        assertRejected(() -> adminService.setLimit("mallory", "ETH", "USDC", BigInteger.TEN),
                AuctionError.UNAUTHORIZED);
        assertRejected(() -> adminService.setProtected("mallory", "alice", true),
                AuctionError.UNAUTHORIZED);
        assertRejected(() -> adminService.grantRole("mallory", AccessControl.ADMIN_ROLE, "mallory"),
                AuctionError.UNAUTHORIZED);
        assertThat(accessControl.hasRole(AccessControl.ADMIN_ROLE, "mallory")).isFalse();
    }

    @Test
    void setLimit_updatesMaxOnly() {
        exposureLimiter.setMax(MARKET, BigInteger.valueOf(100));
        exposureLimiter.reserve(MARKET, BigInteger.valueOf(40));

        adminService.setLimit(ADMIN, "ETH", "USDC", BigInteger.valueOf(500));

        assertThat(exposureLimiter.limit(MARKET).max()).isEqualTo(BigInteger.valueOf(500));
        assertThat(exposureLimiter.limit(MARKET).sum()).isEqualTo(BigInteger.valueOf(40));
    }

    @Test
    void setLimit_rejectsValueOutsideUint128() {
        assertRejected(() -> adminService.setLimit(ADMIN, "ETH", "USDC", WadMath.MAX_U128.add(BigInteger.ONE)),
                AuctionError.INVALID_PARAMETER);
        assertRejected(() -> adminService.setLimit(ADMIN, "ETH", "USDC", BigInteger.valueOf(-1)),
                AuctionError.INVALID_PARAMETER);
    }

    @Test
    void setProtected_togglesOwner() {
        adminService.setProtected(ADMIN, "alice", true);
        assertThat(protectionRegistry.isProtected("alice")).isTrue();

        adminService.setProtected(ADMIN, "alice", false);
        assertThat(protectionRegistry.isProtected("alice")).isFalse();
    }

    @Test
    void grantedRoleCanBeRevoked() {
        adminService.grantRole(ADMIN, AccessControl.ADMIN_ROLE, "ops");
        adminService.setLimit("ops", "ETH", "USDC", BigInteger.TEN);

        adminService.revokeRole(ADMIN, AccessControl.ADMIN_ROLE, "ops");

        assertRejected(() -> adminService.setLimit("ops", "ETH", "USDC", BigInteger.ONE),
                AuctionError.UNAUTHORIZED);
    }

    private static void assertRejected(ThrowingCallable call, AuctionError error) {
        assertThatThrownBy(call)
                .isInstanceOf(AuctionException.class)
                .satisfies(e -> assertThat(((AuctionException) e).getError()).isEqualTo(error));
    }
}

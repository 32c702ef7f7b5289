package com.liquidation.auctionengine.infra.memory;

import com.liquidation.auctionengine.domain.model.VaultBalances;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryVaultLedgerTest {

    private static final BigInteger RATIO = new BigInteger("1500000000000000000");

    private InMemoryVaultLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryVaultLedger();
        ledger.createVault("vault-1", "alice", "ETH", "USDC",
                new BigInteger("100000000000000000000"), new BigInteger("100000000000"));
    }

    @Test
    void collateralizationFollowsSpotAndRatio() {
        ledger.setSpot("ETH", "USDC", BigInteger.valueOf(1_000_000_000L), RATIO);
        assertThat(ledger.isUndercollateralized("vault-1")).isTrue();

        ledger.setSpot("ETH", "USDC", BigInteger.valueOf(1_500_000_000L), RATIO);
        assertThat(ledger.isUndercollateralized("vault-1")).isFalse();
    }

    @Test
    void missingSpotIsAnError() {
        assertThatThrownBy(() -> ledger.isUndercollateralized("vault-1"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unknownVaultIsRejected() {
        assertThatThrownBy(() -> ledger.vault("nope")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reduceBalancesCannotGoNegative() {
        VaultBalances reduced = ledger.reduceBalances("vault-1", BigInteger.TEN, BigInteger.ONE);

        assertThat(reduced.art()).isEqualTo(new BigInteger("99999999999"));
        assertThatThrownBy(() -> ledger.reduceBalances("vault-1", BigInteger.ZERO, new BigInteger("100000000000")))
                .isInstanceOf(ArithmeticException.class);
        assertThat(ledger.balances("vault-1")).isEqualTo(reduced);
    }

    @Test
    void debtConversionUsesRate() {
        ledger.setRate("USDC", new BigInteger("1100000000000000000"));

        assertThat(ledger.convertDebtTokenUnitsToDebtAsset("USDC", BigInteger.valueOf(1_000)))
                .isEqualTo(BigInteger.valueOf(1_100));
        assertThat(ledger.convertDebtAssetToDebtTokenUnits("USDC", BigInteger.valueOf(1_100)))
                .isEqualTo(BigInteger.valueOf(1_000));
        assertThat(ledger.convertDebtAssetToDebtTokenUnits("DAI", BigInteger.valueOf(7)))
                .isEqualTo(BigInteger.valueOf(7));
    }

    @Test
    void dustDefaultsToZeroAndScalesByDecimals() {
        assertThat(ledger.debtLimits("USDC", "ETH").dust()).isZero();

        ledger.setDebtLimits("ETH", "USDC", BigInteger.valueOf(100), 6);

        assertThat(ledger.debtLimits("USDC", "ETH").dust()).isEqualTo(BigInteger.valueOf(100_000_000L));
    }

    @Test
    void custodyAdapterMovesFundsThroughReserves() {
        InMemoryCustodyAdapter usdc = new InMemoryCustodyAdapterRegistry().forAsset("USDC");
        usdc.deposit("bot", BigInteger.valueOf(500));

        usdc.receiveFrom("bot", BigInteger.valueOf(200));
        usdc.releaseTo("treasury", BigInteger.valueOf(150));

        assertThat(usdc.balanceOf("bot")).isEqualTo(BigInteger.valueOf(300));
        assertThat(usdc.balanceOf("treasury")).isEqualTo(BigInteger.valueOf(150));
        assertThat(usdc.reserves()).isEqualTo(BigInteger.valueOf(50));
        assertThat(usdc.canRelease(BigInteger.valueOf(50))).isTrue();
        assertThat(usdc.canRelease(BigInteger.valueOf(51))).isFalse();
        assertThatThrownBy(() -> usdc.receiveFrom("bot", BigInteger.valueOf(301)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> usdc.releaseTo("bot", BigInteger.valueOf(51)))
                .isInstanceOf(IllegalStateException.class);
    }
}

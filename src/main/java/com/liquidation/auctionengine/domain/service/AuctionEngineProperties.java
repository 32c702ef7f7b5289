package com.liquidation.auctionengine.domain.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "auction")
public class AuctionEngineProperties {

    private String engineAccount = "auction-engine";

    private List<String> admins = new ArrayList<>();
    private List<LineConfig> lines = new ArrayList<>();
    private List<LimitConfig> limits = new ArrayList<>();
    private List<String> protectedOwners = new ArrayList<>();
    private Pipeline pipeline = new Pipeline();
    private Ledger ledger = new Ledger();

    @Getter
    @Setter
    public static class LineConfig {
        private String ilkId;
        private String baseId;
        private long duration;
        private BigDecimal initialOffer;
        private BigDecimal proportion;
    }

    @Getter
    @Setter
    public static class LimitConfig {
        private String ilkId;
        private String baseId;
        private BigInteger max;
    }

    @Getter
    @Setter
    public static class Ledger {
        private List<MarketConfig> markets = new ArrayList<>();
        private List<RateConfig> rates = new ArrayList<>();
        private List<VaultConfig> vaults = new ArrayList<>();
        private List<BalanceConfig> balances = new ArrayList<>();
        private List<BalanceConfig> debtTokens = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class MarketConfig {
        private String ilkId;
        private String baseId;
        private BigInteger spot;
        private BigInteger ratio;
        private BigInteger minDebt = BigInteger.ZERO;
        private int decimals;
    }

    @Getter
    @Setter
    public static class RateConfig {
        private String baseId;
        private BigDecimal rate;
    }

    @Getter
    @Setter
    public static class VaultConfig {
        private String vaultId;
        private String owner;
        private String ilkId;
        private String baseId;
        private BigInteger ink;
        private BigInteger art;
    }

    @Getter
    @Setter
    public static class BalanceConfig {
        private String assetId;
        private String account;
        private BigInteger amount;
    }

    @Getter
    @Setter
    public static class Pipeline {
        private int commandBufferSize = 1024;
        private int eventBufferSize = 1024 * 16;
        private long commandTimeoutMs = 5_000;
    }
}

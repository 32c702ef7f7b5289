package com.liquidation.auctionengine.infra.memory;

import com.liquidation.auctionengine.domain.service.AuctionEngineProperties;
import com.liquidation.auctionengine.domain.service.pricing.WadMath;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryLedgerSeeder {

    private final AuctionEngineProperties properties;
    private final InMemoryVaultLedger vaultLedger;
    private final InMemoryCustodyAdapterRegistry custodyAdapters;
    private final InMemoryDebtToken debtToken;

    @PostConstruct
    public void seed() {
        AuctionEngineProperties.Ledger ledger = properties.getLedger();

        for (AuctionEngineProperties.MarketConfig market : ledger.getMarkets()) {
            vaultLedger.setSpot(market.getIlkId(), market.getBaseId(), market.getSpot(),
                    market.getRatio() != null ? market.getRatio() : WadMath.WAD);
            vaultLedger.setDebtLimits(market.getIlkId(), market.getBaseId(), market.getMinDebt(), market.getDecimals());
        }

        for (AuctionEngineProperties.RateConfig rate : ledger.getRates()) {
            vaultLedger.setRate(rate.getBaseId(), WadMath.toWad(rate.getRate()));
        }

        // a vault's collateral sits in the ilk's custody, so payouts can always be released
        for (AuctionEngineProperties.VaultConfig vault : ledger.getVaults()) {
            vaultLedger.createVault(vault.getVaultId(), vault.getOwner(), vault.getIlkId(), vault.getBaseId(),
                    vault.getInk(), vault.getArt());
            custodyAdapters.forAsset(vault.getIlkId()).addReserves(vault.getInk());
        }

        for (AuctionEngineProperties.BalanceConfig balance : ledger.getBalances()) {
            custodyAdapters.forAsset(balance.getAssetId()).deposit(balance.getAccount(), balance.getAmount());
        }

        for (AuctionEngineProperties.BalanceConfig balance : ledger.getDebtTokens()) {
            debtToken.mint(balance.getAssetId(), balance.getAccount(), balance.getAmount());
        }

        log.info("[Init] 인메모리 원장 적재 완료: markets={}, vaults={}, balances={}, debtTokens={}",
                ledger.getMarkets().size(), ledger.getVaults().size(),
                ledger.getBalances().size(), ledger.getDebtTokens().size());
    }
}

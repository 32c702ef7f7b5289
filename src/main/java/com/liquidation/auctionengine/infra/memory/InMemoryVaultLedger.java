package com.liquidation.auctionengine.infra.memory;

import com.liquidation.auctionengine.domain.model.DebtLimits;
import com.liquidation.auctionengine.domain.model.MarketKey;
import com.liquidation.auctionengine.domain.model.VaultBalances;
import com.liquidation.auctionengine.domain.model.VaultInfo;
import com.liquidation.auctionengine.domain.port.VaultLedger;
import com.liquidation.auctionengine.domain.service.pricing.WadMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class InMemoryVaultLedger implements VaultLedger {

    private static final DebtLimits NO_MINIMUM = new DebtLimits(BigInteger.ZERO, 0);

    private final Map<String, VaultInfo> vaults = new ConcurrentHashMap<>();
    private final Map<String, VaultBalances> balances = new ConcurrentHashMap<>();
    private final Map<MarketKey, BigInteger> spots = new ConcurrentHashMap<>();
    private final Map<MarketKey, BigInteger> ratios = new ConcurrentHashMap<>();
    private final Map<MarketKey, DebtLimits> debtLimits = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> rates = new ConcurrentHashMap<>();

    public void createVault(String vaultId, String owner, String ilkId, String baseId,
                            BigInteger ink, BigInteger art) {
        vaults.put(vaultId, new VaultInfo(owner, ilkId, baseId));
        balances.put(vaultId, new VaultBalances(WadMath.u128(ink), WadMath.u128(art)));
        log.debug("[Ledger] vault 생성: vaultId={}, owner={}, ink={}, art={}", vaultId, owner, ink, art);
    }

    public void setSpot(String ilkId, String baseId, BigInteger spot, BigInteger ratio) {
        MarketKey key = MarketKey.of(ilkId, baseId);
        spots.put(key, spot);
        ratios.put(key, ratio);
    }

    public void setDebtLimits(String ilkId, String baseId, BigInteger minDebt, int decimals) {
        debtLimits.put(MarketKey.of(ilkId, baseId), new DebtLimits(minDebt, decimals));
    }

    public void setRate(String baseId, BigInteger rate) {
        rates.put(baseId, rate);
    }

    @Override
    public VaultInfo vault(String vaultId) {
        VaultInfo vault = vaults.get(vaultId);
        if (vault == null) {
            throw new IllegalArgumentException("Vault not found: " + vaultId);
        }
        return vault;
    }

    @Override
    public VaultBalances balances(String vaultId) {
        VaultBalances vaultBalances = balances.get(vaultId);
        if (vaultBalances == null) {
            throw new IllegalArgumentException("Vault not found: " + vaultId);
        }
        return vaultBalances;
    }

    @Override
    public boolean isUndercollateralized(String vaultId) {
        VaultInfo vault = vault(vaultId);
        MarketKey key = vault.marketKey();
        BigInteger spot = spots.get(key);
        if (spot == null) {
            throw new IllegalStateException("No spot price for market " + key);
        }
        VaultBalances vaultBalances = balances(vaultId);
        BigInteger collateralValue = vaultBalances.ink().multiply(spot);
        BigInteger requiredValue = vaultBalances.art().multiply(ratios.getOrDefault(key, WadMath.WAD));
        return collateralValue.compareTo(requiredValue) < 0;
    }

    @Override
    public void transferVaultCustody(String vaultId, String newOwner) {
        VaultInfo vault = vault(vaultId);
        vaults.put(vaultId, new VaultInfo(newOwner, vault.ilkId(), vault.baseId()));
        log.debug("[Ledger] vault 소유권 이전: vaultId={}, {} -> {}", vaultId, vault.owner(), newOwner);
    }

    @Override
    public VaultBalances reduceBalances(String vaultId, BigInteger inkDelta, BigInteger artDelta) {
        VaultBalances current = balances(vaultId);
        VaultBalances updated = new VaultBalances(
                WadMath.sub(current.ink(), inkDelta),
                WadMath.sub(current.art(), artDelta));
        balances.put(vaultId, updated);
        return updated;
    }

    @Override
    public DebtLimits debtLimits(String baseId, String ilkId) {
        return debtLimits.getOrDefault(MarketKey.of(ilkId, baseId), NO_MINIMUM);
    }

    @Override
    public BigInteger convertDebtAssetToDebtTokenUnits(String baseId, BigInteger amount) {
        return WadMath.wdiv(amount, rates.getOrDefault(baseId, WadMath.WAD));
    }

    @Override
    public BigInteger convertDebtTokenUnitsToDebtAsset(String baseId, BigInteger units) {
        return WadMath.wmul(units, rates.getOrDefault(baseId, WadMath.WAD));
    }
}

package com.liquidation.auctionengine.domain.port;

import com.liquidation.auctionengine.domain.model.DebtLimits;
import com.liquidation.auctionengine.domain.model.VaultBalances;
import com.liquidation.auctionengine.domain.model.VaultInfo;

import java.math.BigInteger;

public interface VaultLedger {

    VaultInfo vault(String vaultId);

    VaultBalances balances(String vaultId);

    boolean isUndercollateralized(String vaultId);

    void transferVaultCustody(String vaultId, String newOwner);

    VaultBalances reduceBalances(String vaultId, BigInteger inkDelta, BigInteger artDelta);

    DebtLimits debtLimits(String baseId, String ilkId);

    BigInteger convertDebtAssetToDebtTokenUnits(String baseId, BigInteger amount);

    BigInteger convertDebtTokenUnitsToDebtAsset(String baseId, BigInteger units);
}

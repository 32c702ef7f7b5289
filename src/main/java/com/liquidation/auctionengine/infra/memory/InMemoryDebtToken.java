package com.liquidation.auctionengine.infra.memory;

import com.liquidation.auctionengine.domain.port.DebtToken;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

@Component
public class InMemoryDebtToken implements DebtToken {

    private final Map<String, Map<String, BigInteger>> balances = new HashMap<>();
    private final Map<String, BigInteger> burned = new HashMap<>();

    @Override
    public synchronized void burn(String debtAssetId, String payer, BigInteger amount) {
        BigInteger balance = balanceOf(debtAssetId, payer);
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException(String.format(
                    "Insufficient debt token balance: asset=%s, account=%s, balance=%s, amount=%s",
                    debtAssetId, payer, balance, amount));
        }
        balances.get(debtAssetId).put(payer, balance.subtract(amount));
        burned.merge(debtAssetId, amount, BigInteger::add);
    }

    public synchronized void mint(String debtAssetId, String account, BigInteger amount) {
        balances.computeIfAbsent(debtAssetId, id -> new HashMap<>()).merge(account, amount, BigInteger::add);
    }

    public synchronized BigInteger balanceOf(String debtAssetId, String account) {
        return balances.getOrDefault(debtAssetId, Map.of()).getOrDefault(account, BigInteger.ZERO);
    }

    public synchronized BigInteger totalBurned(String debtAssetId) {
        return burned.getOrDefault(debtAssetId, BigInteger.ZERO);
    }
}

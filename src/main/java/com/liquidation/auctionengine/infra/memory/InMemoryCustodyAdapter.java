package com.liquidation.auctionengine.infra.memory;

import com.liquidation.auctionengine.domain.port.CustodyAdapter;
import com.liquidation.auctionengine.domain.service.pricing.WadMath;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

public class InMemoryCustodyAdapter implements CustodyAdapter {

    private final String assetId;
    private final Map<String, BigInteger> accounts = new HashMap<>();
    private BigInteger reserves = BigInteger.ZERO;

    public InMemoryCustodyAdapter(String assetId) {
        this.assetId = assetId;
    }

    @Override
    public String assetId() {
        return assetId;
    }

    @Override
    public synchronized void receiveFrom(String payer, BigInteger amount) {
        BigInteger balance = balanceOf(payer);
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException(String.format(
                    "Insufficient %s balance: account=%s, balance=%s, amount=%s", assetId, payer, balance, amount));
        }
        accounts.put(payer, balance.subtract(amount));
        reserves = WadMath.add(reserves, amount);
    }

    @Override
    public synchronized boolean canRelease(BigInteger amount) {
        return reserves.compareTo(amount) >= 0;
    }

    @Override
    public synchronized void releaseTo(String receiver, BigInteger amount) {
        if (!canRelease(amount)) {
            throw new IllegalStateException(String.format(
                    "Insufficient %s reserves: reserves=%s, amount=%s", assetId, reserves, amount));
        }
        reserves = reserves.subtract(amount);
        accounts.merge(receiver, amount, BigInteger::add);
    }

    public synchronized void deposit(String account, BigInteger amount) {
        accounts.merge(account, amount, BigInteger::add);
    }

    public synchronized void addReserves(BigInteger amount) {
        reserves = WadMath.add(reserves, amount);
    }

    public synchronized BigInteger balanceOf(String account) {
        return accounts.getOrDefault(account, BigInteger.ZERO);
    }

    public synchronized BigInteger reserves() {
        return reserves;
    }
}

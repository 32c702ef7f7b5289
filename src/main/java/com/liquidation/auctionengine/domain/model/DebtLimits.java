package com.liquidation.auctionengine.domain.model;

import java.math.BigInteger;

public record DebtLimits(BigInteger minDebt, int decimals) {

    public BigInteger dust() {
        return minDebt.multiply(BigInteger.TEN.pow(decimals));
    }
}

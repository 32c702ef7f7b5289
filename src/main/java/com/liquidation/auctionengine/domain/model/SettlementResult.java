package com.liquidation.auctionengine.domain.model;

import java.math.BigInteger;

public record SettlementResult(
        BigInteger inkOut,
        BigInteger amountIn,
        BigInteger artIn,
        boolean completed
) {
}

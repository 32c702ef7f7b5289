package com.liquidation.auctionengine.domain.model;

import java.math.BigInteger;

public record MarketLine(
        long duration,
        BigInteger initialOffer,
        BigInteger proportion
) {
}

package com.liquidation.auctionengine.domain.model;

import java.math.BigInteger;

public record VaultBalances(BigInteger ink, BigInteger art) {
}

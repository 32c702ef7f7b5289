package com.liquidation.auctionengine.domain.model;

import java.math.BigInteger;

public record ExposureLimit(BigInteger max, BigInteger sum) {

    public static final ExposureLimit EMPTY = new ExposureLimit(BigInteger.ZERO, BigInteger.ZERO);

    public boolean isAtCap() {
        return sum.compareTo(max) >= 0;
    }

    public ExposureLimit withMax(BigInteger newMax) {
        return new ExposureLimit(newMax, sum);
    }

    public ExposureLimit withSum(BigInteger newSum) {
        return new ExposureLimit(max, newSum);
    }
}

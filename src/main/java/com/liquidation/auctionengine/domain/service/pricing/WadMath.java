package com.liquidation.auctionengine.domain.service.pricing;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Unsigned fixed-point helpers with 18 decimals. Every result is checked against the
 * uint128 range used for stored balances; nothing wraps.
 */
public final class WadMath {

    public static final BigInteger WAD = BigInteger.TEN.pow(18);
    public static final BigInteger MAX_U128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private WadMath() {
    }

    public static BigInteger u128(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(MAX_U128) > 0) {
            throw new ArithmeticException("uint128 out of range: " + value);
        }
        return value;
    }

    public static BigInteger wmul(BigInteger x, BigInteger y) {
        return u128(x.multiply(y).divide(WAD));
    }

    public static BigInteger wdiv(BigInteger x, BigInteger y) {
        if (y.signum() == 0) {
            throw new ArithmeticException("division by zero");
        }
        return u128(x.multiply(WAD).divide(y));
    }

    public static BigInteger add(BigInteger x, BigInteger y) {
        return u128(x.add(y));
    }

    public static BigInteger sub(BigInteger x, BigInteger y) {
        BigInteger result = x.subtract(y);
        if (result.signum() < 0) {
            throw new ArithmeticException("uint underflow: " + x + " - " + y);
        }
        return result;
    }

    public static BigInteger min(BigInteger x, BigInteger y) {
        return x.compareTo(y) <= 0 ? x : y;
    }

    public static BigInteger toWad(BigDecimal value) {
        return u128(value.movePointRight(18).toBigIntegerExact());
    }
}

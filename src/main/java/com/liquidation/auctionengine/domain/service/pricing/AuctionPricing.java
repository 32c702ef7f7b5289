package com.liquidation.auctionengine.domain.service.pricing;

import com.liquidation.auctionengine.domain.model.AuctionRecord;
import com.liquidation.auctionengine.domain.model.MarketLine;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

import static com.liquidation.auctionengine.domain.service.pricing.WadMath.WAD;

@Component
public class AuctionPricing {

    public BigInteger priceFraction(BigInteger initialOffer, long elapsed, long duration) {
        if (elapsed < 0) {
            throw new ArithmeticException("negative elapsed time: " + elapsed);
        }
        if (duration <= 0) {
            throw new IllegalArgumentException("duration must be positive: " + duration);
        }
        if (elapsed >= duration) {
            return WAD;
        }
        BigInteger progress = WadMath.wdiv(BigInteger.valueOf(elapsed), BigInteger.valueOf(duration));
        return initialOffer.add(WadMath.wmul(WAD.subtract(initialOffer), progress));
    }

    /**
     * Collateral paid for repaying {@code artIn} of the auctioned debt:
     * {@code ink * artIn * fraction / (art * 1e18)}, a single truncating division.
     */
    public BigInteger payout(AuctionRecord record, BigInteger artIn, BigInteger fraction) {
        if (artIn.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger numerator = record.getInk().multiply(artIn).multiply(fraction);
        BigInteger denominator = record.getArt().multiply(WAD);
        return WadMath.u128(numerator.divide(denominator));
    }

    public BigInteger payoutAt(AuctionRecord record, MarketLine line, BigInteger artIn, long now) {
        BigInteger fraction = priceFraction(line.initialOffer(), now - record.getStart(), line.duration());
        return payout(record, artIn, fraction);
    }
}

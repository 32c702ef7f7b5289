package com.liquidation.auctionengine.domain.model;

import com.liquidation.auctionengine.domain.service.pricing.WadMath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@Builder
@ToString
@AllArgsConstructor
public class AuctionRecord {

    private final String vaultId;
    private final String owner;
    private final long start;
    private final String ilkId;
    private final String debtAssetId;
    private final BigInteger art;
    private final BigInteger ink;

    public MarketKey marketKey() {
        return MarketKey.of(ilkId, debtAssetId);
    }

    public AuctionRecord reducedBy(BigInteger artIn, BigInteger inkOut) {
        return new AuctionRecord(vaultId, owner, start, ilkId, debtAssetId,
                WadMath.sub(art, artIn), WadMath.sub(ink, inkOut));
    }
}

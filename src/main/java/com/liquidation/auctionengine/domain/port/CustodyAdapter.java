package com.liquidation.auctionengine.domain.port;

import java.math.BigInteger;

public interface CustodyAdapter {

    String assetId();

    void receiveFrom(String payer, BigInteger amount);

    boolean canRelease(BigInteger amount);

    void releaseTo(String receiver, BigInteger amount);
}

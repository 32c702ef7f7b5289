package com.liquidation.auctionengine.domain.port;

import java.math.BigInteger;

public interface DebtToken {

    void burn(String debtAssetId, String payer, BigInteger amount);
}

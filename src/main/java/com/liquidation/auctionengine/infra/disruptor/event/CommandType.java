package com.liquidation.auctionengine.infra.disruptor.event;

public enum CommandType {
    OPEN,
    CANCEL,
    SETTLE_WITH_ASSET,
    SETTLE_WITH_DEBT_TOKEN,
    SET_LINE,
    SET_LIMIT,
    SET_PROTECTED,
    GRANT_ROLE,
    REVOKE_ROLE
}

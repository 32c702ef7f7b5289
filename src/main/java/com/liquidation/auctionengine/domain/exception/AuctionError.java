package com.liquidation.auctionengine.domain.exception;

import lombok.Getter;

public enum AuctionError {

    NOT_UNDERCOLLATERALIZED("Not undercollateralized"),
    VAULT_ALREADY_AUCTIONED("Vault already under auction"),
    VAULT_NOT_AUCTIONED("Vault not under auction"),
    EXPOSURE_EXCEEDED("Collateral limit reached"),
    STILL_UNDERCOLLATERALIZED("Undercollateralized"),
    NOT_ENOUGH_BOUGHT("Not enough bought"),
    LEAVES_DUST("Leaves dust"),
    INVALID_PARAMETER("Invalid parameter"),
    UNAUTHORIZED("Access denied"),
    VAULT_PROTECTED("Vault is protected"),
    MARKET_NOT_CONFIGURED("Market not configured");

    @Getter
    private final String defaultMessage;

    AuctionError(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }
}

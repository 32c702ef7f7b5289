package com.liquidation.auctionengine.domain.exception;

/**
 * Rejection of an engine command. The command that threw it has made no state change.
 */
public class AuctionException extends RuntimeException {

    private final AuctionError error;

    public AuctionException(AuctionError error) {
        this(error, error.getDefaultMessage());
    }

    public AuctionException(AuctionError error, String message) {
        super(message);
        this.error = error;
    }

    public AuctionError getError() {
        return error;
    }

    public static AuctionException of(AuctionError error, String format, Object... args) {
        return new AuctionException(error, error.getDefaultMessage() + ": " + String.format(format, args));
    }
}

package com.collectible.market.collectible_market.error;

/**
 * Thrown when a settlement operation is rejected.
 * The operation that raised it has been rolled back in full.
 */
public class MarketException extends RuntimeException {

    private final ErrorCode code;

    public MarketException(ErrorCode code) {
        this(code, code.getDefaultMessage());
    }

    public MarketException(ErrorCode code, String message) {
        super(String.format("%s: %s", code, message));
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}

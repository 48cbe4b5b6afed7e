package com.collectible.market.collectible_market.error;

/**
 * Failure classes. All of them are local: the failing operation is rolled back
 * entirely and nothing is retried inside the engine.
 */
public enum ErrorCategory {

    /**
     * Malformed input. The caller can retry with corrected parameters.
     */
    VALIDATION,

    /**
     * Wrong caller or missing approval.
     */
    AUTHORIZATION,

    /**
     * Stale, expired, already settled or sold out. The caller should re-read state.
     */
    STATE,

    /**
     * Wrong amount, missing allowance or unaccepted currency. Funds stay with the caller.
     */
    PAYMENT
}

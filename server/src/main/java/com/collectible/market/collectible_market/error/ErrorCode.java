package com.collectible.market.collectible_market.error;

import static com.collectible.market.collectible_market.error.ErrorCategory.AUTHORIZATION;
import static com.collectible.market.collectible_market.error.ErrorCategory.PAYMENT;
import static com.collectible.market.collectible_market.error.ErrorCategory.STATE;
import static com.collectible.market.collectible_market.error.ErrorCategory.VALIDATION;

public enum ErrorCode {

    // Validation
    INVALID_PROBABILITIES(VALIDATION, "Probabilities must sum to 10,000"),
    LENGTH_MISMATCH(VALIDATION, "URIs and probabilities length mismatch"),
    INVALID_PRICE(VALIDATION, "Price must be > 0"),
    INVALID_WINDOW(VALIDATION, "End time must be after start time"),
    INVALID_PARAMS(VALIDATION, "Invalid parameters"),
    INVALID_QUANTITY(VALIDATION, "Invalid quantity"),
    INVALID_CURRENCY(VALIDATION, "Invalid currency"),
    INVALID_RANGE(VALIDATION, "Invalid range"),

    // Authorization
    NOT_ADMIN(AUTHORIZATION, "Caller is not the admin"),
    NOT_OWNER(AUTHORIZATION, "Seller must own the token"),
    NOT_APPROVED(AUTHORIZATION, "Engine not approved to transfer the token"),
    NOT_APPROVED_OR_OWNER(AUTHORIZATION, "Operator is neither owner nor approved"),
    NOT_CREATOR(AUTHORIZATION, "Caller is not the creator"),
    NOT_APPROVED_BUYER(AUTHORIZATION, "Buyer not approved for reserved listing"),
    NOT_WINNER(AUTHORIZATION, "Caller is not the winning bidder"),

    // State
    NOT_FOUND(STATE, "Record does not exist"),
    SOLD_OUT(STATE, "Set is sold out"),
    PAUSED(STATE, "Market is paused"),
    NOT_ACTIVE(STATE, "Not active"),
    NOT_RESERVED(STATE, "Listing is not reserved"),
    NOT_STARTED(STATE, "Not active yet"),
    EXPIRED(STATE, "Expired"),
    NOT_ENDED(STATE, "Auction has not ended"),
    NO_BIDS(STATE, "Auction has no bids"),
    HAS_BIDS(STATE, "Auction already has bids"),
    ALREADY_COLLECTED(STATE, "Already collected"),
    NOTHING_TO_WITHDRAW(STATE, "No funds to withdraw"),

    // Payment
    WRONG_PAYMENT(PAYMENT, "Incorrect payment amount"),
    PRICE_MISMATCH(PAYMENT, "Incorrect total price expected"),
    PAYMENT_MISMATCH(PAYMENT, "Incorrect native token amount sent"),
    CURRENCY_NOT_ACCEPTED(PAYMENT, "Currency not accepted or approved for this listing"),
    BID_TOO_LOW(PAYMENT, "Bid below the minimum or the bid buffer"),
    INSUFFICIENT_PAYMENT(PAYMENT, "Insufficient payment"),
    INSUFFICIENT_ALLOWANCE(PAYMENT, "Insufficient allowance"),
    INSUFFICIENT_BALANCE(PAYMENT, "Insufficient balance"),
    TRANSFER_REJECTED(PAYMENT, "Recipient rejected the transfer");

    private final ErrorCategory category;
    private final String defaultMessage;

    ErrorCode(ErrorCategory category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}

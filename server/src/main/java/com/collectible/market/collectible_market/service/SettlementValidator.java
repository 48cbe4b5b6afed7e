package com.collectible.market.collectible_market.service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.collectible.market.collectible_market.engine.WeightedDraw;
import com.collectible.market.collectible_market.entity.AuctionParameters;
import com.collectible.market.collectible_market.entity.ListingParameters;
import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.ledger.Currencies;
import com.collectible.market.collectible_market.ledger.OwnershipLedger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Input and custody checks run before any state is touched.
 *
 * Checks are collected in a fixed order; the first failing check decides the
 * error code that reaches the caller and all messages are reported together.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementValidator {

    public static final int MAX_DECAY_EXPONENT = 255;

    private final OwnershipLedger ownershipLedger;

    /**
     * Result of a validation pass.
     */
    public static class ValidationResult {
        private final List<Violation> violations = new ArrayList<>();

        void add(ErrorCode code, String message) {
            violations.add(new Violation(code, message));
        }

        public boolean isValid() {
            return violations.isEmpty();
        }

        public List<ErrorCode> getErrorCodes() {
            return violations.stream().map(v -> v.code).collect(Collectors.toList());
        }

        public String getErrorMessage() {
            return violations.stream().map(v -> v.message).collect(Collectors.joining("; "));
        }

        /**
         * @throws MarketException with the first violation's code
         */
        public void orThrow() {
            if (!isValid()) {
                throw new MarketException(violations.get(0).code, getErrorMessage());
            }
        }
    }

    private static class Violation {
        private final ErrorCode code;
        private final String message;

        private Violation(ErrorCode code, String message) {
            this.code = code;
            this.message = message;
        }
    }

    public ValidationResult validateCardSet(List<String> cardUris, List<Integer> probabilities) {
        ValidationResult result = new ValidationResult();
        if (cardUris.size() != probabilities.size()) {
            result.add(ErrorCode.LENGTH_MISMATCH, String.format(
                    "%d card URIs but %d probabilities", cardUris.size(), probabilities.size()));
        }
        long sum = 0;
        boolean negative = false;
        for (Integer p : probabilities) {
            negative |= p < 0;
            sum += p;
        }
        if (negative || sum != WeightedDraw.TOTAL_WEIGHT) {
            result.add(ErrorCode.INVALID_PROBABILITIES,
                    "Probabilities must be non-negative and sum to 10,000, got " + sum);
        }
        return logged("card set", result);
    }

    public ValidationResult validateListing(String seller, String operator, ListingParameters params, long startTime) {
        ValidationResult result = new ValidationResult();
        checkQuantity(params.getQuantity(), result);
        checkCustody(seller, operator, params.getAssetId(), result);
        if (params.getPricePerUnit() == null || !params.getPricePerUnit().isPositive()) {
            result.add(ErrorCode.INVALID_PRICE, "Price per unit must be > 0");
        }
        checkCurrency(params.getCurrency(), result);
        checkWindow(startTime, params.getEndTime(), result);
        return logged("listing", result);
    }

    public ValidationResult validateAuction(String seller, String operator, AuctionParameters params, long startTime) {
        ValidationResult result = new ValidationResult();
        checkQuantity(params.getQuantity(), result);
        checkCustody(seller, operator, params.getAssetId(), result);
        Money minBid = params.getMinBid();
        Money buyout = params.getBuyoutBid() == null ? Money.ZERO : params.getBuyoutBid();
        if (minBid == null || !minBid.isPositive()) {
            result.add(ErrorCode.INVALID_PARAMS, "Minimum bid must be > 0");
        } else if (buyout.isPositive() && !minBid.isLessThan(buyout)) {
            result.add(ErrorCode.INVALID_PARAMS, "Buyout must be above the minimum bid");
        }
        if (params.getTimeBuffer() <= 0) {
            result.add(ErrorCode.INVALID_PARAMS, "Time buffer must be > 0");
        }
        if (params.getBidBufferBps() <= 0 || params.getBidBufferBps() > FeeSchedule.MAX_BPS) {
            result.add(ErrorCode.INVALID_PARAMS, "Bid buffer must be within (0, 10000] bps");
        }
        checkCurrency(params.getCurrency(), result);
        checkWindow(startTime, params.getEndTime(), result);
        return logged("auction", result);
    }

    public ValidationResult validateDutchAuction(String seller, String operator, long assetId, Money startPrice,
            Money endPrice, long duration, int decayExponent, String currency) {
        ValidationResult result = new ValidationResult();
        if (endPrice == null || !endPrice.isPositive()) {
            result.add(ErrorCode.INVALID_PARAMS, "End price must be > 0");
        } else if (startPrice == null || !endPrice.isLessThan(startPrice)) {
            result.add(ErrorCode.INVALID_PARAMS, "Start price must be above end price");
        }
        if (duration <= 0) {
            result.add(ErrorCode.INVALID_PARAMS, "Duration must be > 0");
        }
        if (decayExponent < 1 || decayExponent > MAX_DECAY_EXPONENT) {
            result.add(ErrorCode.INVALID_PARAMS, "Decay exponent must be within [1, 255]");
        }
        checkCurrency(currency, result);
        checkCustody(seller, operator, assetId, result);
        return logged("dutch auction", result);
    }

    private void checkQuantity(int quantity, ValidationResult result) {
        if (quantity != 1) {
            result.add(ErrorCode.INVALID_QUANTITY, "Quantity must be 1, got " + quantity);
        }
    }

    private void checkCustody(String seller, String operator, long assetId, ValidationResult result) {
        if (!ownershipLedger.exists(assetId) || !ownershipLedger.ownerOf(assetId).equals(seller)) {
            result.add(ErrorCode.NOT_OWNER, seller + " does not own token " + assetId);
            return;
        }
        if (!ownershipLedger.canOperate(operator, assetId)) {
            result.add(ErrorCode.NOT_APPROVED, operator + " is not approved for token " + assetId);
        }
    }

    private void checkCurrency(String currency, ValidationResult result) {
        if (Currencies.isZeroAddress(currency)) {
            result.add(ErrorCode.INVALID_CURRENCY, "Currency cannot be the zero address");
        }
    }

    private void checkWindow(long startTime, long endTime, ValidationResult result) {
        if (endTime <= startTime) {
            result.add(ErrorCode.INVALID_WINDOW,
                    String.format("End time %d must be after start time %d", endTime, startTime));
        }
    }

    private ValidationResult logged(String subject, ValidationResult result) {
        if (!result.isValid()) {
            log.warn("{} validation failed: {}", subject, result.getErrorCodes());
        }
        return result;
    }
}

package com.collectible.market.collectible_market.service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.collectible.market.collectible_market.cache.EnglishAuctionStore;
import com.collectible.market.collectible_market.entity.AuctionParameters;
import com.collectible.market.collectible_market.entity.AuctionStatus;
import com.collectible.market.collectible_market.entity.EnglishAuction;
import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.entity.WinningBid;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.event.AuctionCancelled;
import com.collectible.market.collectible_market.event.AuctionCompleted;
import com.collectible.market.collectible_market.event.AuctionCreated;
import com.collectible.market.collectible_market.event.AuctionPayoutCollected;
import com.collectible.market.collectible_market.event.NewBid;
import com.collectible.market.collectible_market.event.RefundQueued;
import com.collectible.market.collectible_market.event.RefundWithdrawn;
import com.collectible.market.collectible_market.execution.SettlementExecutor;
import com.collectible.market.collectible_market.execution.TransactionJournal;
import com.collectible.market.collectible_market.ledger.Currencies;
import com.collectible.market.collectible_market.ledger.OwnershipLedger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ascending auctions with anti-sniping buffers.
 *
 * The asset moves into the house at creation. Each accepted bid is pulled into
 * escrow and the previous winner is refunded in the same operation, before the
 * new bid is recorded. If the refund is rejected by the recipient it is kept as
 * a pending refund for {@link #withdrawRefund} and the bid still goes through.
 */
@Slf4j
@RequiredArgsConstructor
public class EnglishAuctionHouse {

    private final String houseAddress;
    private final EnglishAuctionStore auctionStore;
    private final OwnershipLedger ownershipLedger;
    private final PayoutLedger payoutLedger;
    private final EscrowVault escrowVault;
    private final SettlementValidator validator;
    private final SystemState systemState;
    private final SettlementExecutor executor;
    private final TransactionJournal journal;
    private final Clock clock;

    private final ConcurrentHashMap<String, Money> pendingRefunds = new ConcurrentHashMap<>();

    /**
     * @return the auction id
     */
    public long createAuction(String callerAddress, AuctionParameters params) {
        String caller = Currencies.normalize(callerAddress);
        return executor.execute("createAuction", () -> {
            long startTime = params.getStartTime() == 0 ? now() : params.getStartTime();
            validator.validateAuction(caller, houseAddress, params, startTime).orThrow();

            ownershipLedger.transfer(houseAddress, caller, houseAddress, params.getAssetId());

            EnglishAuction auction = auctionStore.insert(EnglishAuction.builder()
                    .seller(caller)
                    .assetId(params.getAssetId())
                    .quantity(params.getQuantity())
                    .currency(Currencies.normalize(params.getCurrency()))
                    .minBid(params.getMinBid())
                    .buyoutBid(params.getBuyoutBid() == null ? Money.ZERO : params.getBuyoutBid())
                    .timeBuffer(params.getTimeBuffer())
                    .bidBufferBps(params.getBidBufferBps())
                    .startTime(startTime)
                    .endTime(params.getEndTime())
                    .status(AuctionStatus.CREATED)
                    .build());

            journal.emit(new AuctionCreated(auction.getId(), caller, auction.getAssetId(), auction.getCurrency(),
                    auction.getMinBid(), auction.getBuyoutBid(), auction.getTimeBuffer(),
                    auction.getBidBufferBps(), startTime, auction.getEndTime()));
            log.info("Auction created: id={}, seller={}, asset={}, minBid={}, buyout={}, ends={}",
                    auction.getId(), caller, auction.getAssetId(), auction.getMinBid(),
                    auction.getBuyoutBid(), auction.getEndTime());
            return auction.getId();
        });
    }

    /**
     * Place a bid. {@code value} is the native amount sent with the call:
     * equal to {@code amount} for native auctions, zero for token auctions.
     */
    public void bidInAuction(String callerAddress, long auctionId, Money amount, Money value) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("bidInAuction", () -> {
            systemState.requireNotPaused();
            EnglishAuction current = auctionStore.get(auctionId);
            if (current.getStatus() != AuctionStatus.CREATED) {
                throw new MarketException(ErrorCode.NOT_ACTIVE, "Auction " + auctionId + " is " + current.getStatus());
            }
            long now = now();
            if (now < current.getStartTime()) {
                throw new MarketException(ErrorCode.NOT_STARTED, "Auction " + auctionId + " starts at " + current.getStartTime());
            }
            if (current.isExpiredAt(now)) {
                throw new MarketException(ErrorCode.EXPIRED, "Auction " + auctionId + " ended at " + current.getEndTime());
            }
            if (!isWinningAmount(current, amount)) {
                throw new MarketException(ErrorCode.BID_TOO_LOW, String.format(
                        "Bid %s does not beat minBid %s / current %s by %d bps", amount, current.getMinBid(),
                        current.hasBids() ? current.getWinningBid().getAmount() : Money.ZERO,
                        current.getBidBufferBps()));
            }
            Money requiredValue = Currencies.isNative(current.getCurrency()) ? amount : Money.ZERO;
            if (!value.equals(requiredValue)) {
                throw new MarketException(ErrorCode.PAYMENT_MISMATCH,
                        String.format("Sent %s native, expected %s", value, requiredValue));
            }

            escrowVault.pull(caller, current.getCurrency(), amount);

            EnglishAuction auction = auctionStore.forUpdate(auctionId);
            if (auction.hasBids()) {
                refundOrQueue(auction, auction.getWinningBid());
            }
            auction.setWinningBid(new WinningBid(caller, amount));

            boolean buyout = auction.hasBuyout() && amount.isGreaterThanOrEqualTo(auction.getBuyoutBid());
            if (buyout) {
                auction.setEndTime(now);
            } else if (now + auction.getTimeBuffer() > auction.getEndTime()) {
                auction.setEndTime(now + auction.getTimeBuffer());
                log.debug("Auction {} extended to {}", auctionId, auction.getEndTime());
            }
            journal.emit(new NewBid(auctionId, caller, amount, auction.getEndTime()));
            log.info("Bid accepted: auction={}, bidder={}, amount={}, ends={}",
                    auctionId, caller, amount, auction.getEndTime());

            if (buyout) {
                ownershipLedger.transfer(houseAddress, houseAddress, caller, auction.getAssetId());
                var split = payoutLedger.settleSale(auction.getSeller(), auction.getCurrency(), amount,
                        "auction:" + auctionId);
                auction.setTokensCollected(true);
                auction.setPayoutCollected(true);
                auction.transitionTo(AuctionStatus.COMPLETED);
                journal.emit(new AuctionCompleted(auctionId, auction.getSeller(), caller, auction.getAssetId(), amount));
                journal.emit(new AuctionPayoutCollected(auctionId, auction.getSeller(), auction.getCurrency(),
                        split.getProceeds(), split.getFee()));
                log.info("Auction bought out: id={}, winner={}, amount={}", auctionId, caller, amount);
            }
        });
    }

    public void collectAuctionTokens(String callerAddress, long auctionId) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("collectAuctionTokens", () -> {
            EnglishAuction current = requireSettleable(auctionId);
            if (!current.isWinner(caller)) {
                throw new MarketException(ErrorCode.NOT_WINNER, caller + " did not win auction " + auctionId);
            }
            if (current.isTokensCollected()) {
                throw new MarketException(ErrorCode.ALREADY_COLLECTED, "Tokens of auction " + auctionId + " already collected");
            }

            EnglishAuction auction = auctionStore.forUpdate(auctionId);
            ownershipLedger.transfer(houseAddress, houseAddress, caller, auction.getAssetId());
            auction.setTokensCollected(true);
            auction.transitionTo(AuctionStatus.COMPLETED);

            journal.emit(new AuctionCompleted(auctionId, auction.getSeller(), caller, auction.getAssetId(),
                    auction.getWinningBid().getAmount()));
            log.info("Auction tokens collected: id={}, winner={}", auctionId, caller);
        });
    }

    public void collectAuctionPayout(String callerAddress, long auctionId) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("collectAuctionPayout", () -> {
            EnglishAuction existing = auctionStore.get(auctionId);
            if (!existing.getSeller().equals(caller)) {
                throw new MarketException(ErrorCode.NOT_CREATOR, caller + " did not create auction " + auctionId);
            }
            EnglishAuction current = requireSettleable(auctionId);
            if (current.isPayoutCollected()) {
                throw new MarketException(ErrorCode.ALREADY_COLLECTED, "Payout of auction " + auctionId + " already collected");
            }

            EnglishAuction auction = auctionStore.forUpdate(auctionId);
            Money winningAmount = auction.getWinningBid().getAmount();
            var split = payoutLedger.settleSale(caller, auction.getCurrency(), winningAmount, "auction:" + auctionId);
            auction.setPayoutCollected(true);
            auction.transitionTo(AuctionStatus.COMPLETED);

            journal.emit(new AuctionPayoutCollected(auctionId, caller, auction.getCurrency(),
                    split.getProceeds(), split.getFee()));
            log.info("Auction payout collected: id={}, proceeds={}, fee={}", auctionId, split.getProceeds(), split.getFee());
        });
    }

    public void cancelAuction(String callerAddress, long auctionId) {
        String caller = Currencies.normalize(callerAddress);
        executor.execute("cancelAuction", () -> {
            EnglishAuction current = auctionStore.get(auctionId);
            if (!current.getSeller().equals(caller)) {
                throw new MarketException(ErrorCode.NOT_CREATOR, caller + " did not create auction " + auctionId);
            }
            if (current.getStatus() != AuctionStatus.CREATED) {
                throw new MarketException(ErrorCode.NOT_ACTIVE, "Auction " + auctionId + " is " + current.getStatus());
            }
            if (current.hasBids()) {
                throw new MarketException(ErrorCode.HAS_BIDS, "Auction " + auctionId + " already has bids");
            }

            EnglishAuction auction = auctionStore.forUpdate(auctionId);
            ownershipLedger.transfer(houseAddress, houseAddress, caller, auction.getAssetId());
            auction.transitionTo(AuctionStatus.CANCELLED);

            journal.emit(new AuctionCancelled(auctionId, caller, auction.getAssetId()));
            log.info("Auction cancelled: id={}", auctionId);
        });
    }

    /**
     * Pay out a refund that could not be pushed when the caller was outbid.
     */
    public Money withdrawRefund(String callerAddress, long auctionId) {
        String caller = Currencies.normalize(callerAddress);
        return executor.execute("withdrawRefund", () -> {
            EnglishAuction auction = auctionStore.get(auctionId);
            String key = refundKey(auctionId, caller);
            Money amount = pendingRefunds.get(key);
            if (amount == null) {
                throw new MarketException(ErrorCode.NOTHING_TO_WITHDRAW,
                        "No pending refund for " + caller + " in auction " + auctionId);
            }
            pendingRefunds.remove(key);
            journal.record(() -> pendingRefunds.put(key, amount));
            escrowVault.push(caller, auction.getCurrency(), amount);

            journal.emit(new RefundWithdrawn(auctionId, caller, auction.getCurrency(), amount));
            log.info("Pending refund withdrawn: auction={}, bidder={}, amount={}", auctionId, caller, amount);
            return amount;
        });
    }

    public EnglishAuction getAuction(long auctionId) {
        return executor.read(() -> auctionStore.get(auctionId).copy());
    }

    public long totalAuctions() {
        return executor.read(auctionStore::count);
    }

    public List<EnglishAuction> getAllAuctions(long start, long end) {
        return executor.read(() -> auctionStore.range(start, end).stream()
                .map(EnglishAuction::copy)
                .collect(Collectors.toList()));
    }

    /**
     * Auctions in the range that accept bids right now.
     */
    public List<EnglishAuction> getAllValidAuctions(long start, long end) {
        return executor.read(() -> {
            long now = now();
            return auctionStore.range(start, end).stream()
                    .filter(a -> a.getStatus() == AuctionStatus.CREATED)
                    .filter(a -> now >= a.getStartTime() && !a.isExpiredAt(now))
                    .map(EnglishAuction::copy)
                    .collect(Collectors.toList());
        });
    }

    public Optional<WinningBid> getWinningBid(long auctionId) {
        return executor.read(() -> Optional.ofNullable(auctionStore.get(auctionId).getWinningBid()));
    }

    public boolean isAuctionExpired(long auctionId) {
        return executor.read(() -> auctionStore.get(auctionId).isExpiredAt(now()));
    }

    public boolean isNewWinningBid(long auctionId, Money amount) {
        return executor.read(() -> isWinningAmount(auctionStore.get(auctionId), amount));
    }

    public Money pendingRefund(long auctionId, String bidderAddress) {
        String bidder = Currencies.normalize(bidderAddress);
        return executor.read(() -> pendingRefunds.getOrDefault(refundKey(auctionId, bidder), Money.ZERO));
    }

    /**
     * At least minBid, and at least bidBufferBps above the current winner.
     * A bid that reaches the buyout always wins.
     */
    private boolean isWinningAmount(EnglishAuction auction, Money amount) {
        if (amount.isLessThan(auction.getMinBid())) {
            return false;
        }
        if (!auction.hasBids()) {
            return true;
        }
        if (auction.hasBuyout() && amount.isGreaterThanOrEqualTo(auction.getBuyoutBid())) {
            return amount.compareTo(auction.getWinningBid().getAmount()) > 0;
        }
        return amount.exceedsByAtLeastBps(auction.getWinningBid().getAmount(), auction.getBidBufferBps());
    }

    private void refundOrQueue(EnglishAuction auction, WinningBid previous) {
        try {
            escrowVault.push(previous.getBidder(), auction.getCurrency(), previous.getAmount());
            log.debug("Refunded outbid bidder: auction={}, bidder={}, amount={}",
                    auction.getId(), previous.getBidder(), previous.getAmount());
        } catch (MarketException e) {
            if (e.getCode() != ErrorCode.TRANSFER_REJECTED) {
                throw e;
            }
            String key = refundKey(auction.getId(), previous.getBidder());
            Money before = pendingRefunds.get(key);
            journal.record(() -> {
                if (before == null) {
                    pendingRefunds.remove(key);
                } else {
                    pendingRefunds.put(key, before);
                }
            });
            pendingRefunds.merge(key, previous.getAmount(), Money::add);
            journal.emit(new RefundQueued(auction.getId(), previous.getBidder(), auction.getCurrency(),
                    previous.getAmount()));
            log.warn("Refund rejected, queued for withdrawal: auction={}, bidder={}, amount={}",
                    auction.getId(), previous.getBidder(), previous.getAmount());
        }
    }

    /**
     * Not cancelled, has a winning bid and is past its end time.
     */
    private EnglishAuction requireSettleable(long auctionId) {
        EnglishAuction auction = auctionStore.get(auctionId);
        if (auction.isCancelled()) {
            throw new MarketException(ErrorCode.NOT_ACTIVE, "Auction " + auctionId + " was cancelled");
        }
        if (!auction.hasBids()) {
            throw new MarketException(ErrorCode.NO_BIDS, "Auction " + auctionId + " has no bids");
        }
        if (!auction.isExpiredAt(now())) {
            throw new MarketException(ErrorCode.NOT_ENDED, "Auction " + auctionId + " ends at " + auction.getEndTime());
        }
        return auction;
    }

    private static String refundKey(long auctionId, String bidder) {
        return auctionId + ":" + bidder;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

package com.collectible.market.collectible_market.entity;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Ascending auction. The asset sits in the auction house's escrow from creation
 * until it is collected by the winner or returned on cancellation; the highest
 * bid sits in the funds escrow until the seller collects the payout.
 *
 * tokensCollected and payoutCollected make both collection calls one-shot.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "english_auctions")
public class EnglishAuction implements MarketRecord<EnglishAuction> {

    @MongoId
    private Long id;

    @Indexed
    private String seller;

    private long assetId;
    private int quantity;
    private String currency;

    private Money minBid;

    /**
     * Zero disables buyout.
     */
    @Builder.Default
    private Money buyoutBid = Money.ZERO;

    private long timeBuffer;
    private int bidBufferBps;

    private long startTime;
    private long endTime;

    @Builder.Default
    private AuctionStatus status = AuctionStatus.CREATED;

    private WinningBid winningBid;

    @Builder.Default
    private boolean tokensCollected = false;

    @Builder.Default
    private boolean payoutCollected = false;

    public boolean hasBids() {
        return winningBid != null;
    }

    public boolean hasBuyout() {
        return buyoutBid.isPositive();
    }

    public boolean isCancelled() {
        return status == AuctionStatus.CANCELLED;
    }

    /**
     * Bidding closes strictly after endTime.
     */
    public boolean isExpiredAt(long now) {
        return now > endTime;
    }

    public boolean isWinner(String account) {
        return winningBid != null && winningBid.getBidder().equals(account);
    }

    public void transitionTo(AuctionStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid auction transition: %s -> %s (auction %d)", status, newStatus, id));
        }
        this.status = newStatus;
    }

    @Override
    public EnglishAuction copy() {
        return toBuilder().build();
    }
}

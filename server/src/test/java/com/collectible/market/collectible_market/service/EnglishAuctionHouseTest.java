package com.collectible.market.collectible_market.service;

import static com.collectible.market.collectible_market.support.MarketAssertions.assertRejected;
import static com.collectible.market.collectible_market.support.TestMarket.ADMIN;
import static com.collectible.market.collectible_market.support.TestMarket.ALICE;
import static com.collectible.market.collectible_market.support.TestMarket.BOB;
import static com.collectible.market.collectible_market.support.TestMarket.CAROL;
import static com.collectible.market.collectible_market.support.TestMarket.FEE_RECIPIENT;
import static com.collectible.market.collectible_market.support.TestMarket.HOUSE;
import static com.collectible.market.collectible_market.support.TestMarket.NATIVE;
import static com.collectible.market.collectible_market.support.TestMarket.START;
import static com.collectible.market.collectible_market.support.TestMarket.TOKEN;
import static com.collectible.market.collectible_market.support.TestMarket.eth;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.collectible.market.collectible_market.entity.AuctionParameters;
import com.collectible.market.collectible_market.entity.AuctionStatus;
import com.collectible.market.collectible_market.entity.EnglishAuction;
import com.collectible.market.collectible_market.entity.Money;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.event.AuctionCreated;
import com.collectible.market.collectible_market.event.NewBid;
import com.collectible.market.collectible_market.event.RefundQueued;
import com.collectible.market.collectible_market.support.TestMarket;

class EnglishAuctionHouseTest {

    private final TestMarket market = new TestMarket();
    private long assetId;

    @BeforeEach
    void setUp() {
        assetId = market.assetApprovedFor(ALICE, HOUSE);
        market.fund(BOB, "10");
        market.fund(CAROL, "10");
    }

    @AfterEach
    void tearDown() {
        market.close();
    }

    private AuctionParameters.AuctionParametersBuilder params() {
        return AuctionParameters.builder()
                .assetId(assetId)
                .currency(NATIVE)
                .minBid(eth("1"))
                .timeBuffer(600)
                .bidBufferBps(1000)
                .startTime(0)
                .endTime(START + 3600);
    }

    private void bid(String bidder, long auctionId, String amount) {
        market.auctions.bidInAuction(bidder, auctionId, eth(amount), eth(amount));
    }

    @Nested
    class Creation {

        @Test
        void assetMovesIntoHouse() {
            long id = market.auctions.createAuction(ALICE, params().build());

            assertThat(market.ownership.ownerOf(assetId)).isEqualTo(HOUSE);
            EnglishAuction auction = market.auctions.getAuction(id);
            assertThat(auction.getStatus()).isEqualTo(AuctionStatus.CREATED);
            assertThat(auction.getStartTime()).isEqualTo(START);
            assertThat(market.events.last(AuctionCreated.class).getMinBid()).isEqualTo(eth("1"));
        }

        @Test
        void rejectsInvalidParameters() {
            assertRejected(() -> market.auctions.createAuction(ALICE, params().buyoutBid(eth("1")).build()),
                    ErrorCode.INVALID_PARAMS);
            assertRejected(() -> market.auctions.createAuction(ALICE, params().bidBufferBps(0).build()),
                    ErrorCode.INVALID_PARAMS);
            assertRejected(() -> market.auctions.createAuction(ALICE, params().timeBuffer(0).build()),
                    ErrorCode.INVALID_PARAMS);
            assertRejected(() -> market.auctions.createAuction(ALICE, params().endTime(START - 1).build()),
                    ErrorCode.INVALID_WINDOW);
            assertRejected(() -> market.auctions.createAuction(BOB, params().build()), ErrorCode.NOT_OWNER);

            assertThat(market.ownership.ownerOf(assetId)).isEqualTo(ALICE);
            assertThat(market.auctions.totalAuctions()).isZero();
        }
    }

    @Nested
    class Bidding {

        private long auctionId;

        @BeforeEach
        void create() {
            auctionId = market.auctions.createAuction(ALICE, params().build());
        }

        @Test
        void outbidNeedsBufferAndRefundsPreviousWinner() {
            bid(BOB, auctionId, "1");
            assertThat(market.nativeBalance(BOB)).isEqualTo(eth("9"));

            assertRejected(() -> bid(CAROL, auctionId, "1.05"), ErrorCode.BID_TOO_LOW);
            assertThat(market.auctions.isNewWinningBid(auctionId, eth("1.05"))).isFalse();
            assertThat(market.auctions.isNewWinningBid(auctionId, eth("1.1"))).isTrue();

            bid(CAROL, auctionId, "1.10");

            assertThat(market.nativeBalance(BOB)).isEqualTo(eth("10"));
            assertThat(market.nativeBalance(CAROL)).isEqualTo(eth("8.9"));
            assertThat(market.auctions.getWinningBid(auctionId))
                    .hasValueSatisfying(winner -> assertThat(winner.getBidder()).isEqualTo(CAROL));
            assertThat(market.escrow.heldIn(NATIVE)).isEqualTo(eth("1.1"));
        }

        @Test
        void firstBidMustReachMinimum() {
            assertRejected(() -> bid(BOB, auctionId, "0.99"), ErrorCode.BID_TOO_LOW);
        }

        @Test
        void nativeValueMustEqualBid() {
            assertRejected(() -> market.auctions.bidInAuction(BOB, auctionId, eth("1"), eth("0.5")),
                    ErrorCode.PAYMENT_MISMATCH);
            assertThat(market.nativeBalance(BOB)).isEqualTo(eth("10"));
        }

        @Test
        void lateBidExtendsEndTime() {
            market.clock.advanceSeconds(3500);

            bid(BOB, auctionId, "1");

            assertThat(market.auctions.getAuction(auctionId).getEndTime()).isEqualTo(START + 3500 + 600);
            assertThat(market.events.last(NewBid.class).getEndTime()).isEqualTo(START + 4100);
        }

        @Test
        void earlyBidLeavesEndTimeAlone() {
            market.clock.advanceSeconds(100);

            bid(BOB, auctionId, "1");

            assertThat(market.auctions.getAuction(auctionId).getEndTime()).isEqualTo(START + 3600);
        }

        @Test
        void expiredAuctionRefusesBids() {
            market.clock.advanceSeconds(3601);

            assertThat(market.auctions.isAuctionExpired(auctionId)).isTrue();
            assertRejected(() -> bid(BOB, auctionId, "1"), ErrorCode.EXPIRED);
        }

        @Test
        void pausedMarketRefusesBids() {
            market.systemState.pause(ADMIN);

            assertRejected(() -> bid(BOB, auctionId, "1"), ErrorCode.PAUSED);
        }

        @Test
        void rejectedRefundIsQueuedForWithdrawal() {
            bid(BOB, auctionId, "1");
            market.currency.setRejectIncoming(BOB, true);

            bid(CAROL, auctionId, "1.1");

            assertThat(market.auctions.pendingRefund(auctionId, BOB)).isEqualTo(eth("1"));
            assertThat(market.events.last(RefundQueued.class).getAmount()).isEqualTo(eth("1"));
            assertThat(market.auctions.getWinningBid(auctionId).orElseThrow().getBidder()).isEqualTo(CAROL);

            assertRejected(() -> market.auctions.withdrawRefund(BOB, auctionId), ErrorCode.TRANSFER_REJECTED);
            assertThat(market.auctions.pendingRefund(auctionId, BOB)).isEqualTo(eth("1"));

            market.currency.setRejectIncoming(BOB, false);
            assertThat(market.auctions.withdrawRefund(BOB, auctionId)).isEqualTo(eth("1"));
            assertThat(market.nativeBalance(BOB)).isEqualTo(eth("10"));
            assertThat(market.auctions.pendingRefund(auctionId, BOB)).isEqualTo(Money.ZERO);
            assertRejected(() -> market.auctions.withdrawRefund(BOB, auctionId), ErrorCode.NOTHING_TO_WITHDRAW);
        }
    }

    @Nested
    class Buyout {

        private long auctionId;

        @BeforeEach
        void create() {
            auctionId = market.auctions.createAuction(ALICE, params().buyoutBid(eth("5")).build());
        }

        @Test
        void buyoutSettlesImmediately() {
            bid(BOB, auctionId, "1");

            bid(CAROL, auctionId, "5");

            EnglishAuction auction = market.auctions.getAuction(auctionId);
            assertThat(auction.getStatus()).isEqualTo(AuctionStatus.COMPLETED);
            assertThat(auction.getEndTime()).isEqualTo(START);
            assertThat(auction.isTokensCollected()).isTrue();
            assertThat(auction.isPayoutCollected()).isTrue();
            assertThat(market.ownership.ownerOf(assetId)).isEqualTo(CAROL);
            assertThat(market.payouts.balanceOf(ALICE, NATIVE)).isEqualTo(eth("4.875"));
            assertThat(market.payouts.balanceOf(FEE_RECIPIENT, NATIVE)).isEqualTo(eth("0.125"));
            assertThat(market.nativeBalance(BOB)).isEqualTo(eth("10"));
        }

        @Test
        void buyoutSkipsBidBuffer() {
            bid(BOB, auctionId, "4.8");

            bid(CAROL, auctionId, "5");

            assertThat(market.ownership.ownerOf(assetId)).isEqualTo(CAROL);
        }

        @Test
        void completedAuctionCannotBeCollectedOrBidAgain() {
            bid(CAROL, auctionId, "6");
            market.clock.advanceSeconds(1);

            assertRejected(() -> market.auctions.collectAuctionTokens(CAROL, auctionId), ErrorCode.ALREADY_COLLECTED);
            assertRejected(() -> market.auctions.collectAuctionPayout(ALICE, auctionId), ErrorCode.ALREADY_COLLECTED);
            assertRejected(() -> bid(BOB, auctionId, "7"), ErrorCode.NOT_ACTIVE);
        }
    }

    @Nested
    class Collection {

        private long auctionId;

        @BeforeEach
        void create() {
            auctionId = market.auctions.createAuction(ALICE, params().build());
        }

        @Test
        void winnerAndSellerCollectAfterEnd() {
            bid(BOB, auctionId, "1");
            assertRejected(() -> market.auctions.collectAuctionTokens(BOB, auctionId), ErrorCode.NOT_ENDED);

            market.clock.advanceSeconds(3601);
            assertRejected(() -> market.auctions.collectAuctionTokens(CAROL, auctionId), ErrorCode.NOT_WINNER);
            assertRejected(() -> market.auctions.collectAuctionPayout(BOB, auctionId), ErrorCode.NOT_CREATOR);

            market.auctions.collectAuctionTokens(BOB, auctionId);
            assertThat(market.ownership.ownerOf(assetId)).isEqualTo(BOB);
            assertThat(market.auctions.getAuction(auctionId).getStatus()).isEqualTo(AuctionStatus.COMPLETED);
            assertRejected(() -> market.auctions.collectAuctionTokens(BOB, auctionId), ErrorCode.ALREADY_COLLECTED);

            market.auctions.collectAuctionPayout(ALICE, auctionId);
            assertThat(market.payouts.balanceOf(ALICE, NATIVE)).isEqualTo(eth("0.975"));
            assertThat(market.payouts.balanceOf(FEE_RECIPIENT, NATIVE)).isEqualTo(eth("0.025"));
            assertRejected(() -> market.auctions.collectAuctionPayout(ALICE, auctionId), ErrorCode.ALREADY_COLLECTED);
        }

        @Test
        void payoutMayComeBeforeTokens() {
            bid(BOB, auctionId, "2");
            market.clock.advanceSeconds(3601);

            market.auctions.collectAuctionPayout(ALICE, auctionId);
            market.auctions.collectAuctionTokens(BOB, auctionId);

            assertThat(market.ownership.ownerOf(assetId)).isEqualTo(BOB);
            assertThat(market.payouts.balanceOf(ALICE, NATIVE)).isEqualTo(eth("1.95"));
        }

        @Test
        void auctionWithoutBidsCannotBeCollected() {
            market.clock.advanceSeconds(3601);

            assertRejected(() -> market.auctions.collectAuctionPayout(ALICE, auctionId), ErrorCode.NO_BIDS);
        }

        @Test
        void sellerCancelsOnlyBeforeFirstBid() {
            market.auctions.cancelAuction(ALICE, auctionId);

            assertThat(market.ownership.ownerOf(assetId)).isEqualTo(ALICE);
            assertThat(market.auctions.getAuction(auctionId).getStatus()).isEqualTo(AuctionStatus.CANCELLED);
            assertRejected(() -> bid(BOB, auctionId, "1"), ErrorCode.NOT_ACTIVE);

            long asset = market.assetApprovedFor(ALICE, HOUSE);
            long second = market.auctions.createAuction(ALICE, params().assetId(asset).build());
            bid(BOB, second, "1");
            assertRejected(() -> market.auctions.cancelAuction(BOB, second), ErrorCode.NOT_CREATOR);
            assertRejected(() -> market.auctions.cancelAuction(ALICE, second), ErrorCode.HAS_BIDS);
        }
    }

    @Nested
    class TokenAuction {

        @Test
        void bidsArePulledThroughAllowance() {
            long auctionId = market.auctions.createAuction(ALICE, params().currency(TOKEN).build());
            market.fundToken(BOB, "3");

            assertRejected(() -> market.auctions.bidInAuction(BOB, auctionId, eth("2"), eth("2")),
                    ErrorCode.PAYMENT_MISMATCH);
            market.auctions.bidInAuction(BOB, auctionId, eth("2"), Money.ZERO);

            assertThat(market.currency.balanceOf(BOB, TOKEN)).isEqualTo(eth("1"));
            assertThat(market.escrow.heldIn(TOKEN)).isEqualTo(eth("2"));
            assertThat(market.nativeBalance(BOB)).isEqualTo(eth("10"));
        }
    }

    @Test
    void validAuctionsAreOpenAndUncancelled() {
        long open = market.auctions.createAuction(ALICE, params().build());
        long cancelled = market.auctions.createAuction(ALICE,
                params().assetId(market.assetApprovedFor(ALICE, HOUSE)).build());
        market.auctions.cancelAuction(ALICE, cancelled);
        market.auctions.createAuction(ALICE, params()
                .assetId(market.assetApprovedFor(ALICE, HOUSE))
                .startTime(START + 500)
                .build());

        assertThat(market.auctions.getAllAuctions(0, 2)).hasSize(3);
        assertThat(market.auctions.getAllValidAuctions(0, 2)).extracting(EnglishAuction::getId).containsExactly(open);
    }
}

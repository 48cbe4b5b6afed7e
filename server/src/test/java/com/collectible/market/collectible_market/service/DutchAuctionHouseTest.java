package com.collectible.market.collectible_market.service;

import static com.collectible.market.collectible_market.support.MarketAssertions.assertRejected;
import static com.collectible.market.collectible_market.support.TestMarket.ADMIN;
import static com.collectible.market.collectible_market.support.TestMarket.ALICE;
import static com.collectible.market.collectible_market.support.TestMarket.BOB;
import static com.collectible.market.collectible_market.support.TestMarket.DUTCH;
import static com.collectible.market.collectible_market.support.TestMarket.FEE_RECIPIENT;
import static com.collectible.market.collectible_market.support.TestMarket.NATIVE;
import static com.collectible.market.collectible_market.support.TestMarket.TOKEN;
import static com.collectible.market.collectible_market.support.TestMarket.eth;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.collectible.market.collectible_market.entity.DutchAuction;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.event.DutchAuctionBought;
import com.collectible.market.collectible_market.support.TestMarket;

class DutchAuctionHouseTest {

    private final TestMarket market = new TestMarket();
    private long assetId;

    @BeforeEach
    void setUp() {
        assetId = market.assetApprovedFor(ALICE, DUTCH);
        market.fund(BOB, "5");
    }

    @AfterEach
    void tearDown() {
        market.close();
    }

    private long linearAuction(String currency) {
        return market.dutchAuctions.createDutchAuction(ALICE, assetId, eth("1"), eth("0.5"), 3600, 1, currency);
    }

    @Test
    void priceFallsFromStartToEnd() {
        long id = linearAuction(NATIVE);

        assertThat(market.ownership.ownerOf(assetId)).isEqualTo(DUTCH);
        assertThat(market.dutchAuctions.getCurrentPrice(id)).isEqualTo(eth("1"));
        market.clock.advanceSeconds(1800);
        assertThat(market.dutchAuctions.getCurrentPrice(id)).isEqualTo(eth("0.75"));
        market.clock.advanceSeconds(1800);
        assertThat(market.dutchAuctions.getCurrentPrice(id)).isEqualTo(eth("0.5"));
        market.clock.advanceSeconds(10_000);
        assertThat(market.dutchAuctions.getCurrentPrice(id)).isEqualTo(eth("0.5"));
    }

    @Test
    void higherExponentHoldsPriceLonger() {
        long id = market.dutchAuctions.createDutchAuction(ALICE, assetId, eth("1"), eth("0.5"), 3600, 2, NATIVE);
        market.clock.advanceSeconds(1800);

        assertThat(market.dutchAuctions.getCurrentPrice(id)).isEqualTo(eth("0.875"));
    }

    @Test
    void nativeBuyKeepsOverpayment() {
        long id = linearAuction(NATIVE);
        market.clock.advanceSeconds(1800);

        market.dutchAuctions.buy(BOB, id, eth("0.8"));

        DutchAuction auction = market.dutchAuctions.getAuction(id);
        assertThat(auction.isActive()).isFalse();
        assertThat(auction.getBuyer()).isEqualTo(BOB);
        assertThat(auction.getSoldPrice()).isEqualTo(eth("0.8"));
        assertThat(market.ownership.ownerOf(assetId)).isEqualTo(BOB);
        assertThat(market.nativeBalance(BOB)).isEqualTo(eth("4.2"));
        assertThat(market.payouts.balanceOf(ALICE, NATIVE)).isEqualTo(eth("0.78"));
        assertThat(market.payouts.balanceOf(FEE_RECIPIENT, NATIVE)).isEqualTo(eth("0.02"));
        assertThat(market.events.last(DutchAuctionBought.class).getPrice()).isEqualTo(eth("0.8"));

        assertRejected(() -> market.dutchAuctions.buy(BOB, id, eth("1")), ErrorCode.NOT_ACTIVE);
    }

    @Test
    void paymentBelowCurrentPriceIsRejected() {
        long id = linearAuction(NATIVE);
        market.clock.advanceSeconds(1800);

        assertRejected(() -> market.dutchAuctions.buy(BOB, id, eth("0.7")), ErrorCode.INSUFFICIENT_PAYMENT);

        assertThat(market.nativeBalance(BOB)).isEqualTo(eth("5"));
        assertThat(market.dutchAuctions.getAuction(id).isActive()).isTrue();
    }

    @Test
    void tokenBuyPullsExactPrice() {
        long id = linearAuction(TOKEN);
        market.fundToken(BOB, "1");
        market.clock.advanceSeconds(1800);

        market.dutchAuctions.buy(BOB, id, eth("1"));

        assertThat(market.currency.balanceOf(BOB, TOKEN)).isEqualTo(eth("0.25"));
        assertThat(market.payouts.balanceOf(ALICE, TOKEN)).isEqualTo(eth("0.73125"));
        assertThat(market.dutchAuctions.getAuction(id).getSoldPrice()).isEqualTo(eth("0.75"));
    }

    @Test
    void sellerCancelsAndRecoversAsset() {
        long id = linearAuction(NATIVE);

        assertRejected(() -> market.dutchAuctions.cancelDutchAuction(BOB, id), ErrorCode.NOT_CREATOR);
        market.dutchAuctions.cancelDutchAuction(ALICE, id);

        assertThat(market.ownership.ownerOf(assetId)).isEqualTo(ALICE);
        assertRejected(() -> market.dutchAuctions.cancelDutchAuction(ALICE, id), ErrorCode.NOT_ACTIVE);
        assertRejected(() -> market.dutchAuctions.buy(BOB, id, eth("1")), ErrorCode.NOT_ACTIVE);
    }

    @Test
    void pausedMarketRefusesBuys() {
        long id = linearAuction(NATIVE);
        market.systemState.pause(ADMIN);

        assertRejected(() -> market.dutchAuctions.buy(BOB, id, eth("1")), ErrorCode.PAUSED);
    }

    @Test
    void rejectsInvalidParameters() {
        assertRejected(() -> market.dutchAuctions.createDutchAuction(ALICE, assetId, eth("1"), eth("1"), 3600, 1,
                NATIVE), ErrorCode.INVALID_PARAMS);
        assertRejected(() -> market.dutchAuctions.createDutchAuction(ALICE, assetId, eth("1"), eth("0.5"), 0, 1,
                NATIVE), ErrorCode.INVALID_PARAMS);
        assertRejected(() -> market.dutchAuctions.createDutchAuction(ALICE, assetId, eth("1"), eth("0.5"), 3600, 0,
                NATIVE), ErrorCode.INVALID_PARAMS);
        assertRejected(() -> market.dutchAuctions.createDutchAuction(ALICE, assetId, eth("1"), eth("0.5"), 3600, 256,
                NATIVE), ErrorCode.INVALID_PARAMS);
        assertRejected(() -> market.dutchAuctions.createDutchAuction(BOB, assetId, eth("1"), eth("0.5"), 3600, 1,
                NATIVE), ErrorCode.NOT_OWNER);

        assertThat(market.dutchAuctions.totalAuctions()).isZero();
        assertThat(market.ownership.ownerOf(assetId)).isEqualTo(ALICE);
    }
}

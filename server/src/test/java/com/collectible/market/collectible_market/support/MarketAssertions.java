package com.collectible.market.collectible_market.support;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;

public final class MarketAssertions {

    private MarketAssertions() {
    }

    public static void assertRejected(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOf(MarketException.class)
                .extracting(e -> ((MarketException) e).getCode())
                .isEqualTo(expected);
    }
}

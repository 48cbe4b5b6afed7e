package com.collectible.market.collectible_market.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

class WeightedDrawTest {

    private final WeightedDraw draw = new WeightedDraw();

    @Test
    void selectsFirstIndexWhoseCumulativeWeightExceedsDraw() {
        List<Integer> weights = List.of(9999, 1);

        assertThat(draw.select(weights, BigInteger.ZERO)).isZero();
        assertThat(draw.select(weights, BigInteger.valueOf(9998))).isZero();
        assertThat(draw.select(weights, BigInteger.valueOf(9999))).isEqualTo(1);
    }

    @Test
    void reducesSeedModuloTotalWeight() {
        List<Integer> weights = List.of(5000, 3000, 2000);

        assertThat(draw.select(weights, BigInteger.valueOf(10_000 + 7999))).isEqualTo(1);
        assertThat(draw.select(weights, BigInteger.TWO.pow(255).add(BigInteger.valueOf(8000))))
                .isEqualTo(draw.select(weights, BigInteger.TWO.pow(255).add(BigInteger.valueOf(8000))));
    }

    @Test
    void boundaryBelongsToTheLaterIndex() {
        List<Integer> weights = List.of(5000, 5000);

        assertThat(draw.select(weights, BigInteger.valueOf(4999))).isZero();
        assertThat(draw.select(weights, BigInteger.valueOf(5000))).isEqualTo(1);
    }

    @Test
    void zeroWeightOutcomesAreNeverSelected() {
        List<Integer> weights = List.of(0, 10_000, 0);

        for (int r = 0; r < 10_000; r += 333) {
            assertThat(draw.select(weights, BigInteger.valueOf(r))).isEqualTo(1);
        }
    }

    @Test
    void sameSeedAlwaysGivesSameIndex() {
        List<Integer> weights = List.of(1200, 3300, 4500, 1000);
        BigInteger seed = new BigInteger("98765432109876543210");

        int first = draw.select(weights, seed);
        for (int i = 0; i < 10; i++) {
            assertThat(draw.select(weights, seed)).isEqualTo(first);
        }
    }

    @Test
    void rejectsWeightsThatDoNotCoverTheRange() {
        assertThatThrownBy(() -> draw.select(List.of(10, 20), BigInteger.valueOf(500)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.collectible.market.collectible_market.entity;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Integer money type for settlement calculations.
 *
 * Amounts are held as whole base units (like wei), never as fractions, so fee
 * splits and price decay truncate the same way on every path. Display and
 * parsing use {@link #DECIMALS} decimal places.
 *
 * Immutable and thread-safe. Negative amounts are rejected.
 */
public final class Money implements Comparable<Money> {

    /**
     * Decimal places between a display unit and a base unit (1 ETH = 10^18 wei).
     */
    public static final int DECIMALS = 18;

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private final BigInteger units;

    // Common constants
    public static final Money ZERO = new Money(BigInteger.ZERO);

    private Money(BigInteger units) {
        if (units == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (units.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + units);
        }
        this.units = units;
    }

    /**
     * Create Money from a count of base units.
     */
    public static Money ofUnits(BigInteger units) {
        return new Money(units);
    }

    public static Money ofUnits(long units) {
        return new Money(BigInteger.valueOf(units));
    }

    /**
     * Create Money from a decimal display amount, e.g. "0.5" ether.
     * Fails if the amount has more than {@link #DECIMALS} decimal places.
     */
    public static Money of(String amount) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            BigDecimal scaled = new BigDecimal(amount.trim()).movePointRight(DECIMALS);
            return new Money(scaled.toBigIntegerExact());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
    }

    public Money add(Money other) {
        return new Money(this.units.add(other.units));
    }

    /**
     * Subtract Money value. The result must not be negative.
     */
    public Money subtract(Money other) {
        return new Money(this.units.subtract(other.units));
    }

    /**
     * Multiply by a quantity.
     */
    public Money multiply(long quantity) {
        return new Money(this.units.multiply(BigInteger.valueOf(quantity)));
    }

    /**
     * Share of this amount in basis points, truncated: floor(amount * bps / 10000).
     */
    public Money bps(int basisPoints) {
        return new Money(this.units.multiply(BigInteger.valueOf(basisPoints)).divide(BPS_DENOMINATOR));
    }

    /**
     * True if this amount is at least {@code base * (1 + bps / 10000)}, compared exactly.
     */
    public boolean exceedsByAtLeastBps(Money base, int basisPoints) {
        BigInteger lhs = this.units.multiply(BPS_DENOMINATOR);
        BigInteger rhs = base.units.multiply(BPS_DENOMINATOR.add(BigInteger.valueOf(basisPoints)));
        return lhs.compareTo(rhs) >= 0;
    }

    public boolean isPositive() {
        return this.units.signum() > 0;
    }

    public boolean isZero() {
        return this.units.signum() == 0;
    }

    public boolean isGreaterThanOrEqualTo(Money other) {
        return this.compareTo(other) >= 0;
    }

    public boolean isLessThan(Money other) {
        return this.compareTo(other) < 0;
    }

    /**
     * Get underlying base units (for persistence/serialization and curve math).
     */
    public BigInteger toUnits() {
        return units;
    }

    /**
     * Display amount in whole units (use only for logs and display).
     */
    public String toDisplayString() {
        return new BigDecimal(units).movePointLeft(DECIMALS).stripTrailingZeros().toPlainString();
    }

    @Override
    public int compareTo(Money other) {
        return this.units.compareTo(other.units);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Money money = (Money) obj;
        return units.equals(money.units);
    }

    @Override
    public int hashCode() {
        return Objects.hash(units);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}

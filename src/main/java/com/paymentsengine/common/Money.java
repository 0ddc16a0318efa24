package com.paymentsengine.common;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Immutable value object representing a monetary amount.
 * Uses BigDecimal at a fixed scale of four fractional digits so that repeated
 * add/subtract cycles never drift. Extra precision is truncated toward zero.
 */
@Getter
@EqualsAndHashCode
public final class Money implements Comparable<Money> {

    public static final int SCALE = 4;

    /**
     * Largest number of digits allowed before the decimal point.
     */
    public static final int MAX_INTEGER_DIGITS = 28;

    public static final Money ZERO = new Money(BigDecimal.ZERO.setScale(SCALE));

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount;
    }

    /**
     * @throws ArithmeticException if the amount has more than {@link #MAX_INTEGER_DIGITS} integer digits
     */
    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (amount.signum() == 0) {
            return ZERO;
        }
        // long arithmetic: precision - scale overflows int for exponents near Integer.MIN_VALUE
        long integerDigits = (long) amount.precision() - amount.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) {
            throw new ArithmeticException("Amount exceeds " + MAX_INTEGER_DIGITS + " integer digits");
        }
        if (integerDigits < -SCALE) {
            // Below 0.0001 in magnitude, truncates to zero
            return ZERO;
        }
        return new Money(amount.setScale(SCALE, RoundingMode.DOWN));
    }

    /**
     * Parse a decimal literal such as {@code "1.5"} or {@code "-0.00005"}.
     *
     * @throws NumberFormatException if the text is not a decimal number
     * @throws ArithmeticException if the value is out of range
     */
    public static Money of(String amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return of(new BigDecimal(amount.trim()));
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    public boolean isGreaterThanOrEqual(Money other) {
        return this.amount.compareTo(other.amount) >= 0;
    }

    public boolean isLessThan(Money other) {
        return this.amount.compareTo(other.amount) < 0;
    }

    public boolean isNegative() {
        return this.amount.signum() < 0;
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    /**
     * Decimal text with trailing zeros stripped and no exponent, e.g. {@code 1.5} or {@code 0}.
     */
    public String toPlainString() {
        return amount.stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return toPlainString();
    }
}

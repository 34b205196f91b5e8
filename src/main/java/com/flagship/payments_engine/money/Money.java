package com.flagship.payments_engine.money;

import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Exact monetary value with four fractional digits.
 *
 * Stored as a signed long scaled by 10,000 (1.5 is held as 15000).
 * All arithmetic is exact integer addition and subtraction.
 *
 * Key invariant: rounding only happens when a value enters the system
 * ({@link #parse(String)}, {@link #of(double)}), never during arithmetic.
 */
@EqualsAndHashCode
public final class Money implements Comparable<Money> {

    public static final int SCALE = 4;
    public static final long ONE = 10_000L;

    public static final Money ZERO = new Money(0L);

    private static final int MAX_INTEGER_DIGITS = 19;

    private final long scaled;

    private Money(long scaled) {
        this.scaled = scaled;
    }

    /**
     * Creates a value from its raw representation in ten-thousandths.
     * E.g. {@code Money.ofScaled(15000)} is 1.5.
     */
    public static Money ofScaled(long scaled) {
        return scaled == 0L ? ZERO : new Money(scaled);
    }

    /**
     * Parses decimal text, rounding half away from zero to four fractional digits.
     *
     * @param text decimal text such as {@code "1.5"}, {@code " -0.00005 "} or {@code "2e3"}
     * @return the parsed value
     * @throws NumberFormatException if the text is not a decimal number
     */
    public static Money parse(String text) {
        if (text == null) {
            throw new NumberFormatException("Amount text is null");
        }
        return of(new BigDecimal(text.trim()));
    }

    /**
     * Converts a float, rounding half away from zero to four fractional digits.
     */
    public static Money of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("Not a finite amount: " + value);
        }
        return of(BigDecimal.valueOf(value));
    }

    /**
     * Converts a decimal, rounding half away from zero to four fractional digits.
     *
     * @throws ArithmeticException if the value does not fit the scaled long range
     */
    public static Money of(BigDecimal value) {
        // integer digits; checked before setScale, which would expand a huge exponent
        int integerDigits = value.precision() - value.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) {
            throw new ArithmeticException("Amount out of range: " + value);
        }
        if (integerDigits < -SCALE) {
            // below 0.00001 in magnitude, rounds to zero
            return ZERO;
        }
        BigDecimal rounded = value.setScale(SCALE, RoundingMode.HALF_UP);
        return ofScaled(rounded.unscaledValue().longValueExact());
    }

    public long getScaled() {
        return scaled;
    }

    public Money plus(Money other) {
        return ofScaled(scaled + other.scaled);
    }

    public Money minus(Money other) {
        return plus(other.negate());
    }

    public Money negate() {
        return ofScaled(-scaled);
    }

    public boolean isNegative() {
        return scaled < 0L;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    public BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(scaled, SCALE);
    }

    @Override
    public int compareTo(Money other) {
        return Long.compare(scaled, other.scaled);
    }

    /**
     * Canonical text: sign, whole part, and the fraction with trailing zeros
     * stripped. A zero fraction is omitted, so 10.0 renders as {@code 10}.
     */
    @Override
    public String toString() {
        long whole = Math.abs(scaled / ONE);
        long fraction = Math.abs(scaled % ONE);

        StringBuilder text = new StringBuilder();
        if (scaled < 0L) {
            text.append('-');
        }
        text.append(whole);
        if (fraction != 0L) {
            String digits = String.format("%04d", fraction);
            int end = digits.length();
            while (digits.charAt(end - 1) == '0') {
                end--;
            }
            text.append('.').append(digits, 0, end);
        }
        return text.toString();
    }
}

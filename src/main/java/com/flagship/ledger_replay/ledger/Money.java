package com.flagship.ledger_replay.ledger;

import lombok.EqualsAndHashCode;

/**
 * Fixed-point amount of money.
 *
 * Stored as a signed 64-bit count of 1/10,000 units, so {@code 1.2345} is held
 * as {@code 12345}. Arithmetic is exact and overflow-checked; an overflow is
 * reported as {@link TxError#OVERFLOW} and never wraps.
 */
@EqualsAndHashCode
public final class Money implements Comparable<Money> {

    public static final int FRACTION_DIGITS = 4;
    public static final long SCALE = 10_000L;

    public static final Money ZERO = new Money(0L);

    private final long scaled;

    private Money(long scaled) {
        this.scaled = scaled;
    }

    public static Money ofScaled(long scaled) {
        return scaled == 0L ? ZERO : new Money(scaled);
    }

    public long getScaled() {
        return scaled;
    }

    public Money add(Money other) throws TransactionException {
        try {
            return ofScaled(Math.addExact(scaled, other.scaled));
        } catch (ArithmeticException e) {
            throw new TransactionException(TxError.OVERFLOW);
        }
    }

    public Money subtract(Money other) throws TransactionException {
        try {
            return ofScaled(Math.subtractExact(scaled, other.scaled));
        } catch (ArithmeticException e) {
            throw new TransactionException(TxError.OVERFLOW);
        }
    }

    public boolean isNegative() {
        return scaled < 0L;
    }

    @Override
    public int compareTo(Money other) {
        return Long.compare(scaled, other.scaled);
    }

    /**
     * Renders the amount as {@code [-]<integer>.<4 digits>}.
     * Zero never carries a sign.
     */
    public String toText() {
        String sign = scaled < 0L ? "-" : "";
        // unsigned arithmetic keeps Long.MIN_VALUE printable
        long magnitude = Math.abs(scaled);
        String integerPart = Long.toUnsignedString(Long.divideUnsigned(magnitude, SCALE));
        long fractionPart = Long.remainderUnsigned(magnitude, SCALE);
        return String.format("%s%s.%04d", sign, integerPart, fractionPart);
    }

    @Override
    public String toString() {
        return toText();
    }
}

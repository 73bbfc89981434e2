package com.coinbase.x402quote.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Human-readable, non-negative money value such as {@code "0.01"}.
 * Converted to token base units only when a payment requirement is finalized.
 */
public final class MoneyAmount {
    private final BigDecimal value;

    private MoneyAmount(BigDecimal value) {
        this.value = value;
    }

    /**
     * Parses a decimal money string. A leading {@code $} and {@code ,} grouping separators are accepted.
     *
     * @throws InvalidAmountException if the string is not a non-negative decimal
     */
    public static MoneyAmount parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidAmountException("Money amount is empty");
        }
        String normalized = text.trim().replace(",", "");
        if (normalized.startsWith("$")) {
            normalized = normalized.substring(1);
        }
        try {
            return of(new BigDecimal(normalized));
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Malformed money amount: " + text, e);
        }
    }

    /** @throws InvalidAmountException if the value is negative */
    public static MoneyAmount of(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new InvalidAmountException("Money amount must not be negative: " + value.toPlainString());
        }
        return new MoneyAmount(value);
    }

    public BigDecimal value() {
        return value;
    }

    public MoneyAmount times(long quantity) {
        return of(value.multiply(BigDecimal.valueOf(quantity)));
    }

    /**
     * Converts to the smallest unit of a token with the given number of decimals,
     * e.g. {@code 0.05} with 6 decimals is {@code "50000"}.
     *
     * @throws InvalidAmountException if the amount has more fractional digits than the token
     */
    public String toTokenAmount(int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative");
        }
        try {
            BigInteger units = value.movePointRight(decimals).toBigIntegerExact();
            return units.toString();
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(
                    "Amount " + this + " is not representable with " + decimals + " decimals", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MoneyAmount)) return false;
        return value.compareTo(((MoneyAmount) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }
}

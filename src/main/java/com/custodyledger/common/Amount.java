package com.custodyledger.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.math.BigInteger;

/**
 * Immutable, non-negative quantity of the ledger's single value unit.
 *
 * Amounts are whole counts of the smallest indivisible unit. Arithmetic fails
 * closed: an operation that would produce a negative amount throws instead of
 * wrapping or clamping.
 */
@EqualsAndHashCode
public final class Amount implements Comparable<Amount> {

    public static final Amount ZERO = new Amount(BigInteger.ZERO);

    private final BigInteger units;

    private Amount(BigInteger units) {
        this.units = units;
    }

    @JsonCreator
    public static Amount of(BigInteger units) {
        if (units == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (units.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + units);
        }
        return units.signum() == 0 ? ZERO : new Amount(units);
    }

    public static Amount of(long units) {
        return of(BigInteger.valueOf(units));
    }

    public static Amount of(String units) {
        if (units == null || units.isBlank()) {
            throw new IllegalArgumentException("Amount cannot be blank");
        }
        try {
            return of(new BigInteger(units.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Amount is not a whole number: " + units, e);
        }
    }

    @JsonValue
    public BigInteger getUnits() {
        return units;
    }

    public Amount add(Amount other) {
        return new Amount(units.add(other.units));
    }

    /**
     * @throws ArithmeticException if {@code other} is larger than this amount
     */
    public Amount subtract(Amount other) {
        if (other.units.compareTo(units) > 0) {
            throw new ArithmeticException(
                String.format("Amount underflow: %s - %s", units, other.units));
        }
        return of(units.subtract(other.units));
    }

    public boolean isZero() {
        return units.signum() == 0;
    }

    public boolean isPositive() {
        return units.signum() > 0;
    }

    public boolean isGreaterThan(Amount other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Amount other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Amount other) {
        return units.compareTo(other.units);
    }

    @Override
    public String toString() {
        return units.toString();
    }
}

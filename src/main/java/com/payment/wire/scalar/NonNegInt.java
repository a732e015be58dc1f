package com.payment.wire.scalar;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Integer greater than or equal to zero (charge amounts, counters).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NonNegInt {

    public static final NonNegInt ZERO = new NonNegInt(0);

    long value;

    public static NonNegInt of(long value) {
        Optional<String> violation = check(value);
        if (violation.isPresent()) {
            throw new InvalidValueException(violation.get());
        }
        return value == 0 ? ZERO : new NonNegInt(value);
    }

    /** Returns the reason {@code value} is negative, or empty when it is acceptable. */
    public static Optional<String> check(long value) {
        return value >= 0 ? Optional.empty() : Optional.of("must be >= 0 but was " + value);
    }
}

package com.payment.wire.scalar;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Integer strictly greater than zero (quantities, expiry months, refund amounts).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PosInt {

    long value;

    public static PosInt of(long value) {
        Optional<String> violation = check(value);
        if (violation.isPresent()) {
            throw new InvalidValueException(violation.get());
        }
        return new PosInt(value);
    }

    /** Returns the reason {@code value} is not a positive integer, or empty when it is. */
    public static Optional<String> check(long value) {
        return value > 0 ? Optional.empty() : Optional.of("must be > 0 but was " + value);
    }
}

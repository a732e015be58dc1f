package com.payment.wire.scalar;

/**
 * Thrown when constructing a validated scalar from a value that breaks its predicate.
 * The decoder reports the same predicate failures as VALIDATION_FAILED instead.
 */
public class InvalidValueException extends IllegalArgumentException {

    public InvalidValueException(String message) {
        super(message);
    }
}

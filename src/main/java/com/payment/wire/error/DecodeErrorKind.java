package com.payment.wire.error;

/**
 * Why a decode call failed. Each kind is reported with the path of the offending field.
 */
public enum DecodeErrorKind {
    /** A required field is absent (or null where null is not allowed). */
    MISSING_FIELD,
    /** The field is present but has the wrong JSON type, or the wrong {@code object} tag. */
    TYPE_MISMATCH,
    /** The value is well-typed but breaks a scalar or structural rule (negative amount, oversized metadata). */
    VALIDATION_FAILED,
    /** A string tag outside the closed set of a strict enumeration. */
    UNKNOWN_ENUM_TAG,
    /** The payload is an API error body instead of the expected object. */
    UPSTREAM_ERROR
}

package com.payment.wire.error;

/**
 * Thrown when a JSON value cannot be decoded into an entity. Decoding is all-or-nothing:
 * no partially decoded value is ever returned alongside this exception.
 */
public class DecodeException extends RuntimeException {

    private final DecodeErrorKind kind;
    private final String path;
    private final String reason;

    public DecodeException(DecodeErrorKind kind, String path, String reason) {
        super(kind + " at " + path + ": " + reason);
        this.kind = kind;
        this.path = path;
        this.reason = reason;
    }

    public DecodeException(DecodeErrorKind kind, String path, String reason, Throwable cause) {
        super(kind + " at " + path + ": " + reason, cause);
        this.kind = kind;
        this.path = path;
        this.reason = reason;
    }

    public static DecodeException missingField(String path) {
        return new DecodeException(DecodeErrorKind.MISSING_FIELD, path, "required field is missing");
    }

    public static DecodeException typeMismatch(String path, String expected, String actual) {
        return new DecodeException(DecodeErrorKind.TYPE_MISMATCH, path,
                "expected " + expected + " but was " + actual);
    }

    public static DecodeException validationFailed(String path, String reason) {
        return new DecodeException(DecodeErrorKind.VALIDATION_FAILED, path, reason);
    }

    public static DecodeException unknownEnumTag(String path, String tag, Iterable<String> known) {
        return new DecodeException(DecodeErrorKind.UNKNOWN_ENUM_TAG, path,
                "unrecognized tag '" + tag + "', expected one of " + known);
    }

    public DecodeErrorKind getKind() {
        return kind;
    }

    /** Dotted field path from the entity root, e.g. {@code customer.sources.data[2].exp_year}. */
    public String getPath() {
        return path;
    }

    public String getReason() {
        return reason;
    }
}

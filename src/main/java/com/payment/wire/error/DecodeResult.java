package com.payment.wire.error;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a decoded value or the {@link DecodeException} describing why decoding failed.
 */
public final class DecodeResult<T> {

    private final T value;
    private final DecodeException error;

    private DecodeResult(T value, DecodeException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> DecodeResult<T> success(T value) {
        return new DecodeResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> DecodeResult<T> failure(DecodeException error) {
        return new DecodeResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<DecodeException> getError() {
        return Optional.ofNullable(error);
    }

    /** Returns the value or rethrows the decode failure. */
    public T orElseThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    public <R> DecodeResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "DecodeResult[success=" + value + "]" : "DecodeResult[failure=" + error.getMessage() + "]";
    }
}

package com.payment.wire.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * A field where the API distinguishes "not sent" from "sent as null", e.g. a customer's currency,
 * which is null until the first charge and omitted by older API versions. Encoding writes the field
 * back in the same state it was decoded in.
 */
public final class NullableField<T> {

    private enum State { ABSENT, NULL, PRESENT }

    private static final NullableField<?> ABSENT = new NullableField<>(State.ABSENT, null);
    private static final NullableField<?> NULL = new NullableField<>(State.NULL, null);

    private final State state;
    private final T value;

    private NullableField(State state, T value) {
        this.state = state;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> NullableField<T> absent() {
        return (NullableField<T>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    public static <T> NullableField<T> ofNull() {
        return (NullableField<T>) NULL;
    }

    public static <T> NullableField<T> of(T value) {
        return new NullableField<>(State.PRESENT, Objects.requireNonNull(value, "value"));
    }

    public boolean isAbsent() {
        return state == State.ABSENT;
    }

    public boolean isNull() {
        return state == State.NULL;
    }

    public boolean isPresent() {
        return state == State.PRESENT;
    }

    /** The value when present; empty for both absent and null. */
    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NullableField)) return false;
        NullableField<?> that = (NullableField<?>) o;
        return state == that.state && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        switch (state) {
            case ABSENT:
                return "absent";
            case NULL:
                return "null";
            default:
                return String.valueOf(value);
        }
    }
}

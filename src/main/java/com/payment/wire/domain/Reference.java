package com.payment.wire.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * An expandable relation: the API returns either the related object's id or, when the request asked
 * for expansion, the whole object. Which one arrives is decided by the request, so the decoder picks
 * the variant from the JSON shape alone.
 *
 * @param <T> type of the related entity
 */
public abstract class Reference<T> {

    private Reference() {
    }

    public static <T> Reference<T> id(String id) {
        return new Id<>(id);
    }

    public static <T> Reference<T> embedded(String id, T value) {
        return new Embedded<>(id, value);
    }

    /** Id of the related object; available for both variants. */
    public abstract String getId();

    public abstract boolean isEmbedded();

    public abstract Optional<T> getEmbedded();

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Id<T> extends Reference<T> {
        @NonNull String id;

        @Override
        public boolean isEmbedded() {
            return false;
        }

        @Override
        public Optional<T> getEmbedded() {
            return Optional.empty();
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Embedded<T> extends Reference<T> {
        @NonNull String id;
        @NonNull T value;

        @Override
        public boolean isEmbedded() {
            return true;
        }

        @Override
        public Optional<T> getEmbedded() {
            return Optional.of(value);
        }
    }
}

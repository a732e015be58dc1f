package com.payment.wire.scalar;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value strings the API lets callers attach to most objects. Insertion order is kept so that
 * encoding writes pairs back in the order they were received.
 * Limits: at most {@value #MAX_PAIRS} pairs, keys up to {@value #MAX_KEY_LENGTH} characters,
 * values up to {@value #MAX_VALUE_LENGTH} characters.
 */
@EqualsAndHashCode
public final class Metadata {

    public static final int MAX_PAIRS = 10;
    public static final int MAX_KEY_LENGTH = 40;
    public static final int MAX_VALUE_LENGTH = 500;

    private static final Metadata EMPTY = new Metadata(Collections.emptyMap());

    private final Map<String, String> entries;

    private Metadata(Map<String, String> entries) {
        this.entries = entries;
    }

    public static Metadata empty() {
        return EMPTY;
    }

    public static Metadata of(Map<String, String> entries) {
        Optional<String> violation = check(entries);
        if (violation.isPresent()) {
            throw new InvalidValueException(violation.get());
        }
        if (entries.isEmpty()) {
            return EMPTY;
        }
        return new Metadata(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    /**
     * Returns the first limit {@code entries} breaks, or empty when the map is acceptable.
     * Null keys or values are reported as violations.
     */
    public static Optional<String> check(Map<String, String> entries) {
        if (entries.size() > MAX_PAIRS) {
            return Optional.of("at most " + MAX_PAIRS + " pairs allowed but got " + entries.size());
        }
        for (Map.Entry<String, String> e : entries.entrySet()) {
            Optional<String> violation = checkPair(e.getKey(), e.getValue());
            if (violation.isPresent()) {
                return violation;
            }
        }
        return Optional.empty();
    }

    /** Checks a single pair; used by the decoder to point at the offending key. */
    public static Optional<String> checkPair(String key, String value) {
        if (key == null || value == null) {
            return Optional.of("keys and values must be non-null");
        }
        if (key.codePointCount(0, key.length()) > MAX_KEY_LENGTH) {
            return Optional.of("key '" + key + "' longer than " + MAX_KEY_LENGTH + " characters");
        }
        if (value.codePointCount(0, value.length()) > MAX_VALUE_LENGTH) {
            return Optional.of("value for key '" + key + "' longer than " + MAX_VALUE_LENGTH + " characters");
        }
        return Optional.empty();
    }

    /** Unmodifiable view in wire order. */
    public Map<String, String> asMap() {
        return entries;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "Metadata" + entries;
    }
}

package com.schemaidentity.model.config;

import java.util.OptionalInt;

import lombok.EqualsAndHashCode;

/**
 * Number of characters kept from the start of a digest.
 */
@EqualsAndHashCode
public final class HashLimit {

    public static final HashLimit UNBOUNDED = new HashLimit(-1);

    private final int length;

    private HashLimit(int length) {
        this.length = length;
    }

    public static HashLimit of(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Hash limit must be >= 0. Got: " + length);
        }
        return new HashLimit(length);
    }

    /**
     * Parses {@code "unbounded"} (any case) or a non-negative integer.
     */
    public static HashLimit parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Hash limit is empty");
        }
        String trimmed = raw.trim();
        if ("unbounded".equalsIgnoreCase(trimmed)) {
            return UNBOUNDED;
        }
        try {
            return of(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Hash limit must be an integer or 'unbounded'. Got: " + raw, e);
        }
    }

    public boolean isUnbounded() {
        return length < 0;
    }

    public OptionalInt getLength() {
        return isUnbounded() ? OptionalInt.empty() : OptionalInt.of(length);
    }

    /**
     * Truncates a digest. Never pads, never fails.
     */
    public String apply(String digest) {
        if (isUnbounded() || length >= digest.length()) {
            return digest;
        }
        return digest.substring(0, length);
    }

    @Override
    public String toString() {
        return isUnbounded() ? "unbounded" : Integer.toString(length);
    }
}

package com.schemaidentity.identity.hash;

import com.schemaidentity.model.config.HashLimit;

import lombok.NonNull;

/**
 * Applies the configured hash function and truncates the digest.
 */
public class HashComputer {

    public String hash(@NonNull byte[] input, @NonNull HashFunction function, @NonNull HashLimit limit) {
        String digest = function.hash(input);
        if (digest == null) {
            throw new IllegalStateException("Hash function returned null");
        }
        return limit.apply(digest);
    }
}

package com.schemaidentity.identity.hash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import lombok.experimental.UtilityClass;

/**
 * Stock {@link HashFunction}s, rendering digests as lowercase hex.
 */
@UtilityClass
public class HashFunctions {

    private static final HashFunction MD5_HEX = digestHex("MD5");
    private static final HashFunction SHA256_HEX = digestHex("SHA-256");

    /**
     * MD5 as 32 hex characters. Fast and collision-resistant enough for schema identity.
     */
    public static HashFunction md5Hex() {
        return MD5_HEX;
    }

    /**
     * SHA-256 as 64 hex characters.
     */
    public static HashFunction sha256Hex() {
        return SHA256_HEX;
    }

    /**
     * Resolves {@code md5} or {@code sha256} (case-insensitive, dashes ignored).
     */
    public static HashFunction byName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace("-", "");
        return switch (normalized) {
            case "md5" -> MD5_HEX;
            case "sha256" -> SHA256_HEX;
            default -> throw new IllegalArgumentException("Unknown hash function: " + name + " (expected md5 or sha256)");
        };
    }

    /**
     * {@link MessageDigest} instances are not thread-safe, so each call gets its own.
     */
    public static HashFunction digestHex(String algorithm) {
        try {
            MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Digest algorithm not available: " + algorithm, e);
        }
        return input -> {
            try {
                MessageDigest md = MessageDigest.getInstance(algorithm);
                return HexFormat.of().formatHex(md.digest(input));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("Digest algorithm disappeared: " + algorithm, e);
            }
        };
    }
}

package com.schemaidentity.identity.hash;

/**
 * One-way function from the serialized hash input to a printable digest.
 */
@FunctionalInterface
public interface HashFunction {
    String hash(byte[] input);
}

package com.schemaidentity.cli.model;

import java.nio.file.Path;

import com.schemaidentity.identity.hash.HashFunction;
import com.schemaidentity.model.config.HashLimit;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps HashCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedHashOptions {
    HashLimit hashLimit;
    HashFunction hashFunction;
    Path serByAlias;
    Path serByName;
    /** Null when validation-mode tracking is off. */
    Path valByAlias;
}

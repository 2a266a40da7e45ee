package com.schemaidentity.model.config;

import com.schemaidentity.identity.hash.HashFunction;
import com.schemaidentity.identity.hash.HashFunctions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Per-type configuration of the identity hash.
 *
 * A type defined on top of a parent starts from the parent's resolved config and
 * overrides individual fields through {@link #toBuilder()}. The value stored on the
 * type is final; nothing is looked up through the hierarchy later.
 */
@Value
@Builder(toBuilder = true)
public class HashConfig {

    public static final HashConfig DEFAULTS = HashConfig.builder().build();

    /**
     * Include descriptions (type and field documentation) in the hash. Disable to
     * track only runtime behavior; enable to also track documentation changes.
     */
    boolean trackDescriptions;

    /**
     * Field declaration order affects the hash.
     */
    boolean trackFieldOrder;

    /**
     * Order of union members, enum/constant values and any other lists found in
     * type annotations affects the hash.
     */
    boolean trackTypeOrder;

    /**
     * Arbitrary JSON-serializable data folded into the hash (static configs, prompts,
     * anything known at startup). {@code null} means none. The hash is computed once
     * and cached, so never mutate this object after the type is defined.
     */
    Object trackedExtraData;

    /**
     * Characters kept from the start of the digest. 10-14 characters offer plenty of
     * collision resistance.
     */
    @NonNull
    @Builder.Default
    HashLimit hashLimit = HashLimit.of(12);

    /**
     * Trailing segments of the declaring location included in the qualified name.
     * With {@code 2}, a type declared in {@code a/b/c/d.py} is named {@code c.d.Type}.
     */
    @Builder.Default
    int trackedFilepathParts = 2;

    @NonNull
    @Builder.Default
    HashFunction hashFunction = HashFunctions.md5Hex();

    /**
     * Also hash the validation-mode document, in addition to the serialization-mode
     * documents that are always tracked. Disabling only saves generation time.
     */
    @Builder.Default
    boolean trackValidationMode = true;

    public HashSettings toSettings() {
        return HashSettings.from(this);
    }
}

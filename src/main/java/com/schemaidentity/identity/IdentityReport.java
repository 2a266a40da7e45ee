package com.schemaidentity.identity;

import java.time.Instant;

import com.schemaidentity.model.config.HashSettings;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifying information about a type's schema: its qualified name, when the report
 * was created, the identity hash and the settings that produced it.
 */
@Value
@Builder
public class IdentityReport {

    @NonNull
    String fullname;

    @NonNull
    Instant createdAt;

    @NonNull
    String hash;

    @NonNull
    HashSettings hashSettings;
}

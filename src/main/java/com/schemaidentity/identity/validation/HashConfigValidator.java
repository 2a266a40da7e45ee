package com.schemaidentity.identity.validation;

import java.util.Optional;

import com.schemaidentity.identity.exception.ConfigConflictException;
import com.schemaidentity.model.SchemaMode;
import com.schemaidentity.model.SchemaType;

import lombok.NonNull;

/**
 * Rejects type configurations the hash pipeline cannot honor. Runs before any
 * schema is generated.
 */
public class HashConfigValidator {

    /**
     * A pinned schema mode makes it impossible to generate both the serialization and
     * the validation document that validation-mode tracking asks for.
     *
     * @throws ConfigConflictException on an override combined with validation tracking
     */
    public void validate(@NonNull SchemaType type) {
        Optional<SchemaMode> override = type.getSchemaModeOverride();
        if (override.isPresent() && type.getConfig().isTrackValidationMode()) {
            throw new ConfigConflictException(type.getName(), override.get());
        }
    }
}

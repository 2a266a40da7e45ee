package com.schemaidentity.identity.exception;

import com.schemaidentity.model.SchemaMode;

/**
 * A type pins its schema mode while validation-mode tracking needs both modes.
 */
public class ConfigConflictException extends SchemaIdentityException {

    private static final long serialVersionUID = 1L;

    private final SchemaMode override;

    public ConfigConflictException(String typeName, SchemaMode override) {
        super(typeName, "Type '" + typeName + "' sets schemaModeOverride=" + override
                + ", but identity hashes with validation-mode tracking need both serialization and validation "
                + "schemas. Either remove the override, or disable trackValidationMode for this type.", null);
        this.override = override;
    }

    public SchemaMode getOverride() {
        return override;
    }
}

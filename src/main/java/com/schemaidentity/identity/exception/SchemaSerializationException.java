package com.schemaidentity.identity.exception;

/**
 * The hash input for a type could not be encoded.
 */
public class SchemaSerializationException extends SchemaIdentityException {

    private static final long serialVersionUID = 1L;

    public SchemaSerializationException(String qualifiedName, Throwable cause) {
        super(qualifiedName, "The schema data for '" + qualifiedName + "' failed JSON serialization, so the "
                + "identity hash can't be computed. Error: " + cause.getClass().getSimpleName() + ": "
                + cause.getMessage(), cause);
    }
}

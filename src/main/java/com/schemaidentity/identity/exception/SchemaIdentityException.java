package com.schemaidentity.identity.exception;

/**
 * Base of the errors raised while computing an identity hash. Both kinds are
 * configuration mistakes: they surface synchronously and are never retried.
 */
public abstract class SchemaIdentityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String typeName;

    protected SchemaIdentityException(String typeName, String message, Throwable cause) {
        super(message, cause);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}

package com.schemaidentity.model;

/**
 * Which side of a type's contract a schema document describes.
 */
public enum SchemaMode {
    /** Shape of the data the type produces when dumped. */
    SERIALIZATION,
    /** Shape of the input the type accepts. */
    VALIDATION
}

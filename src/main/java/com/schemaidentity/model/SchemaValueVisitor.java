package com.schemaidentity.model;

/**
 * Visitor pattern interface for traversing schema document trees.
 */
public interface SchemaValueVisitor<R> {
    R visit(SchemaObject object);
    R visit(SchemaArray array);
    R visit(SchemaString string);
    R visit(SchemaNumber number);
    R visit(SchemaBoolean bool);
    R visit(SchemaNull nul);
}

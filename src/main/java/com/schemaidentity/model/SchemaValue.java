package com.schemaidentity.model;

import java.util.List;

/**
 * Base class for all nodes of a schema document tree.
 *
 * A document is built from objects (string keys, insertion-ordered), arrays and
 * scalars. Nodes are immutable; transforms always return new trees.
 */
public abstract class SchemaValue {

    public abstract <R> R accept(SchemaValueVisitor<R> visitor);

    /**
     * Text form used when a value is coerced to a string. Strings render raw,
     * every other node renders as compact JSON.
     */
    public String asText() {
        return toJson();
    }

    /**
     * Compact JSON rendering, keys in insertion order.
     */
    public String toJson() {
        StringBuilder sb = new StringBuilder();
        appendJson(sb);
        return sb.toString();
    }

    protected abstract void appendJson(StringBuilder sb);

    @Override
    public String toString() {
        return toJson();
    }

    // ---- Factories ----

    public static SchemaString string(String value) {
        return new SchemaString(value);
    }

    public static SchemaNumber number(Number value) {
        return new SchemaNumber(value);
    }

    public static SchemaBoolean bool(boolean value) {
        return value ? SchemaBoolean.TRUE : SchemaBoolean.FALSE;
    }

    public static SchemaNull nullValue() {
        return SchemaNull.INSTANCE;
    }

    public static SchemaArray array(SchemaValue... elements) {
        return new SchemaArray(List.of(elements));
    }

    public static SchemaArray array(List<? extends SchemaValue> elements) {
        return new SchemaArray(elements);
    }
}

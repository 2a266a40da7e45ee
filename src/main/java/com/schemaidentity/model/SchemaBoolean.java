package com.schemaidentity.model;

public final class SchemaBoolean extends SchemaValue {

    static final SchemaBoolean TRUE = new SchemaBoolean(true);
    static final SchemaBoolean FALSE = new SchemaBoolean(false);

    private final boolean value;

    private SchemaBoolean(boolean value) {
        this.value = value;
    }

    public boolean isValue() {
        return value;
    }

    @Override
    public <R> R accept(SchemaValueVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    protected void appendJson(StringBuilder sb) {
        sb.append(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SchemaBoolean other && other.value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}

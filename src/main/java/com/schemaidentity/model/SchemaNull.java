package com.schemaidentity.model;

public final class SchemaNull extends SchemaValue {

    static final SchemaNull INSTANCE = new SchemaNull();

    private SchemaNull() {
    }

    @Override
    public <R> R accept(SchemaValueVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    protected void appendJson(StringBuilder sb) {
        sb.append("null");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SchemaNull;
    }

    @Override
    public int hashCode() {
        return 0;
    }
}

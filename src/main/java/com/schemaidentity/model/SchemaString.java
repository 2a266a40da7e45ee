package com.schemaidentity.model;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class SchemaString extends SchemaValue {

    @NonNull
    String value;

    @Override
    public <R> R accept(SchemaValueVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String asText() {
        return value;
    }

    @Override
    protected void appendJson(StringBuilder sb) {
        sb.append('"');
        sb.append(JsonStringEncoder.getInstance().quoteAsString(value));
        sb.append('"');
    }

    @Override
    public String toString() {
        return toJson();
    }
}

package com.schemaidentity.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class SchemaNumber extends SchemaValue {

    @NonNull
    Number value;

    @Override
    public <R> R accept(SchemaValueVisitor<R> visitor) {
        return visitor.visit(this);
    }

    /**
     * NaN and infinities have no JSON encoding.
     */
    public boolean isFinite() {
        if (value instanceof Double d) {
            return Double.isFinite(d);
        }
        if (value instanceof Float f) {
            return Float.isFinite(f);
        }
        return true;
    }

    @Override
    protected void appendJson(StringBuilder sb) {
        // floats are written widened to double, matching the envelope encoding
        sb.append(value instanceof Float f ? Double.toString(f.doubleValue()) : value.toString());
    }

    @Override
    public String toString() {
        return toJson();
    }
}

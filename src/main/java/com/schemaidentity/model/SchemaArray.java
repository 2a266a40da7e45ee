package com.schemaidentity.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Ordered list node.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class SchemaArray extends SchemaValue {

    List<SchemaValue> elements;

    public SchemaArray(@NonNull List<? extends SchemaValue> elements) {
        this.elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public SchemaValue get(int index) {
        return elements.get(index);
    }

    @Override
    public <R> R accept(SchemaValueVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    protected void appendJson(StringBuilder sb) {
        sb.append('[');
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            elements.get(i).appendJson(sb);
        }
        sb.append(']');
    }

    @Override
    public String toString() {
        return toJson();
    }
}

package com.schemaidentity.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * String-keyed map node. Keys keep their insertion order, which mirrors the
 * declared field order of the schema that produced the document.
 */
@EqualsAndHashCode(callSuper = false)
public final class SchemaObject extends SchemaValue {

    private static final SchemaObject EMPTY = new SchemaObject(Map.of());

    private final Map<String, SchemaValue> entries;

    public SchemaObject(@NonNull Map<String, ? extends SchemaValue> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static SchemaObject empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, SchemaValue> getEntries() {
        return entries;
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public SchemaValue get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public <R> R accept(SchemaValueVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    protected void appendJson(StringBuilder sb) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, SchemaValue> e : entries.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            SchemaValue.string(e.getKey()).appendJson(sb);
            sb.append(':');
            e.getValue().appendJson(sb);
        }
        sb.append('}');
    }

    @Override
    public String toString() {
        return toJson();
    }

    /**
     * Insertion-ordered builder. Re-putting a key replaces its value in place.
     */
    public static final class Builder {

        private final Map<String, SchemaValue> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(@NonNull String key, @NonNull SchemaValue value) {
            entries.put(key, value);
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, SchemaValue.string(value));
        }

        public Builder put(String key, Number value) {
            return put(key, SchemaValue.number(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, SchemaValue.bool(value));
        }

        public Builder putNull(String key) {
            return put(key, SchemaValue.nullValue());
        }

        public SchemaObject build() {
            return new SchemaObject(entries);
        }
    }
}

package com.schemaidentity.identity.serialization;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.schemaidentity.identity.exception.SchemaSerializationException;
import com.schemaidentity.model.SchemaArray;
import com.schemaidentity.model.SchemaBoolean;
import com.schemaidentity.model.SchemaNumber;
import com.schemaidentity.model.SchemaObject;
import com.schemaidentity.model.SchemaString;
import com.schemaidentity.model.SchemaValue;

import lombok.NonNull;

/**
 * Encodes a hash input envelope as compact UTF-8 JSON.
 *
 * With {@code sortKeys} every object's keys are written in sorted order, so logically
 * equal envelopes produce identical bytes. Without it keys keep insertion order, which
 * is how field declaration order reaches the hash.
 */
public class EnvelopeSerializer {

    private final JsonFactory jsonFactory;

    public EnvelopeSerializer() {
        this(new JsonFactory());
    }

    public EnvelopeSerializer(@NonNull JsonFactory jsonFactory) {
        this.jsonFactory = jsonFactory;
    }

    /**
     * @param qualifiedName name of the owning type, reported on failure
     * @throws SchemaSerializationException if any value has no JSON encoding
     */
    public byte[] serialize(String qualifiedName, @NonNull SchemaValue envelope, boolean sortKeys) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator generator = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
            write(generator, envelope, sortKeys);
        } catch (IOException | IllegalArgumentException e) {
            throw new SchemaSerializationException(qualifiedName, e);
        }
        return out.toByteArray();
    }

    private void write(JsonGenerator g, SchemaValue value, boolean sortKeys) throws IOException {
        if (value instanceof SchemaObject object) {
            writeObject(g, object, sortKeys);
        } else if (value instanceof SchemaArray array) {
            g.writeStartArray();
            for (SchemaValue element : array.getElements()) {
                write(g, element, sortKeys);
            }
            g.writeEndArray();
        } else if (value instanceof SchemaNumber number) {
            writeNumber(g, number);
        } else if (value instanceof SchemaString string) {
            g.writeString(string.getValue());
        } else if (value instanceof SchemaBoolean bool) {
            g.writeBoolean(bool.isValue());
        } else {
            g.writeNull();
        }
    }

    private void writeObject(JsonGenerator g, SchemaObject object, boolean sortKeys) throws IOException {
        List<String> keys = new ArrayList<>(object.keys());
        if (sortKeys) {
            keys.sort(null);
        }
        Map<String, SchemaValue> entries = object.getEntries();
        g.writeStartObject();
        for (String key : keys) {
            g.writeFieldName(key);
            write(g, entries.get(key), sortKeys);
        }
        g.writeEndObject();
    }

    private void writeNumber(JsonGenerator g, SchemaNumber number) throws IOException {
        if (!number.isFinite()) {
            throw new IllegalArgumentException("Number is not JSON-representable: " + number.getValue());
        }
        Number n = number.getValue();
        if (n instanceof BigDecimal decimal) {
            g.writeNumber(decimal);
        } else if (n instanceof BigInteger integer) {
            g.writeNumber(integer);
        } else if (n instanceof Double || n instanceof Float) {
            g.writeNumber(n.doubleValue());
        } else {
            g.writeNumber(n.longValue());
        }
    }
}

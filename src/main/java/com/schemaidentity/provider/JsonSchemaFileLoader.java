package com.schemaidentity.provider;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemaidentity.identity.serialization.SchemaValues;
import com.schemaidentity.model.SchemaObject;
import com.schemaidentity.model.SchemaValue;

import lombok.NonNull;

/**
 * Reads JSON schema documents (and arbitrary JSON payloads) from disk. Object key
 * order is preserved as written in the file.
 */
public class JsonSchemaFileLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonSchemaFileLoader.class);

    private final ObjectMapper mapper;

    public JsonSchemaFileLoader() {
        this(new ObjectMapper());
    }

    public JsonSchemaFileLoader(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SchemaObject loadSchema(@NonNull Path file) throws IOException {
        JsonNode tree = read(file);
        if (!tree.isObject()) {
            throw new IOException("Schema document must be a JSON object: " + file);
        }
        return SchemaValues.objectFromJsonNode(tree);
    }

    public SchemaValue loadValue(@NonNull Path file) throws IOException {
        return SchemaValues.fromJsonNode(read(file));
    }

    private JsonNode read(Path file) throws IOException {
        log.debug("Reading JSON from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode tree = mapper.readTree(in);
            if (tree == null || tree.isMissingNode()) {
                throw new IOException("Empty JSON file: " + file);
            }
            return tree;
        }
    }
}

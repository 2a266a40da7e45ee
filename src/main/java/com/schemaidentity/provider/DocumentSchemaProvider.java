package com.schemaidentity.provider;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemaidentity.model.Aliasing;
import com.schemaidentity.model.SchemaMode;
import com.schemaidentity.model.SchemaObject;
import com.schemaidentity.model.SchemaType;

import lombok.NonNull;

/**
 * In-memory {@link SchemaProvider} serving documents registered up front, one per
 * (type, mode, aliasing). Useful when schemas are generated elsewhere (build plugin,
 * another service) and handed over as JSON.
 */
public class DocumentSchemaProvider implements SchemaProvider {

    private static final Logger log = LoggerFactory.getLogger(DocumentSchemaProvider.class);

    private final Map<SchemaType, Map<SchemaMode, Map<Aliasing, SchemaObject>>> documents = new ConcurrentHashMap<>();

    public DocumentSchemaProvider register(@NonNull SchemaType type, @NonNull SchemaMode mode,
                                          @NonNull Aliasing aliasing, @NonNull SchemaObject document) {
        documents.computeIfAbsent(type, t -> new ConcurrentHashMap<>())
                .computeIfAbsent(mode, m -> new ConcurrentHashMap<>())
                .put(aliasing, document);
        log.debug("Registered {} / {} schema for {}", mode, aliasing, type);
        return this;
    }

    /**
     * Registers the same document for every mode/aliasing combination, for types with
     * no aliases and no mode-specific fields.
     */
    public DocumentSchemaProvider registerAll(SchemaType type, SchemaObject document) {
        for (SchemaMode mode : SchemaMode.values()) {
            for (Aliasing aliasing : Aliasing.values()) {
                register(type, mode, aliasing, document);
            }
        }
        return this;
    }

    @Override
    public SchemaObject generate(@NonNull SchemaType type, @NonNull SchemaMode mode, @NonNull Aliasing aliasing) {
        SchemaObject document = documents.getOrDefault(type, Map.of())
                .getOrDefault(mode, Map.of())
                .get(aliasing);
        if (document == null) {
            throw new IllegalStateException("No " + mode + " / " + aliasing + " schema registered for type " + type);
        }
        return document;
    }
}

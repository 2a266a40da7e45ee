package com.schemaidentity.model;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

import com.schemaidentity.model.config.HashConfig;

import lombok.NonNull;

/**
 * A registered type definition. Its runtime identity (this object) is the cache key
 * for everything computed about the type; two definitions with the same name and the
 * same fields are still distinct types.
 *
 * Equality is identity: {@code equals}/{@code hashCode} must stay un-overridden.
 */
public final class SchemaType {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private final String name;
    private final String location;
    private final SchemaType parent;
    private final SchemaMode schemaModeOverride;
    private final HashConfig config;

    private SchemaType(Definition definition) {
        this.id = NEXT_ID.getAndIncrement();
        this.name = definition.name;
        this.location = definition.location;
        this.parent = definition.parent;
        this.schemaModeOverride = definition.schemaModeOverride;
        this.config = definition.config;
    }

    /**
     * Starts a new root type definition using {@link HashConfig#DEFAULTS}.
     */
    public static Definition define(@NonNull String name) {
        return new Definition(name, null);
    }

    /**
     * Starts a type definition that inherits this type's config, location and
     * schema-mode override. Anything set on the returned definition overrides the
     * inherited value.
     */
    public Definition extend(@NonNull String name) {
        return new Definition(name, this);
    }

    /** Registration order id, for diagnostics only. */
    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * Declaring location (a path such as {@code src/models/orders.py} or
     * {@code com/acme/Order.java}), if known.
     */
    public Optional<String> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<SchemaType> getParent() {
        return Optional.ofNullable(parent);
    }

    public Optional<SchemaMode> getSchemaModeOverride() {
        return Optional.ofNullable(schemaModeOverride);
    }

    public HashConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }

    /**
     * Fluent definition of a {@link SchemaType}. A subtype definition starts from the
     * parent's config.
     */
    public static final class Definition {

        private final String name;
        private final SchemaType parent;
        private String location;
        private SchemaMode schemaModeOverride;
        private HashConfig config;

        private Definition(String name, SchemaType parent) {
            this.name = name;
            this.parent = parent;
            if (parent != null) {
                this.location = parent.location;
                this.schemaModeOverride = parent.schemaModeOverride;
                this.config = parent.config;
            } else {
                this.config = HashConfig.DEFAULTS;
            }
        }

        public Definition location(String location) {
            this.location = location;
            return this;
        }

        public Definition schemaModeOverride(SchemaMode mode) {
            this.schemaModeOverride = mode;
            return this;
        }

        /**
         * Replaces the base config entirely; later {@link #configure} calls apply on top.
         */
        public Definition config(@NonNull HashConfig config) {
            this.config = config;
            return this;
        }

        public Definition configure(@NonNull UnaryOperator<HashConfig.HashConfigBuilder> overrides) {
            this.config = overrides.apply(config.toBuilder()).build();
            return this;
        }

        public SchemaType register() {
            return new SchemaType(this);
        }
    }
}

package com.schemaidentity.identity;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemaidentity.identity.hash.HashComputer;
import com.schemaidentity.model.SchemaType;
import com.schemaidentity.model.config.HashConfig;
import com.schemaidentity.provider.FullnameResolver;
import com.schemaidentity.provider.PathFullnameResolver;
import com.schemaidentity.provider.SchemaProvider;

import lombok.NonNull;

/**
 * Computes and caches identity hashes and reports, one entry per {@link SchemaType}.
 *
 * <p>Both stores are keyed by type identity, never by name or structure, and a miss is
 * never answered from a parent type's entry: a subtype gets its own hash even when the
 * parent's was cached first.
 *
 * <p>Entries are created at most once per (type, store); concurrent first access
 * blocks on the computing thread. A failing computation leaves the store untouched.
 * Nothing is persisted; entries live as long as the registry.
 */
public class SchemaIdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaIdentityRegistry.class);

    private final Map<SchemaType, String> hashes = new ConcurrentHashMap<>();
    private final Map<SchemaType, IdentityReport> reports = new ConcurrentHashMap<>();

    private final HashInputBuilder inputBuilder;
    private final HashComputer hashComputer;
    private final Clock clock;

    public SchemaIdentityRegistry(SchemaProvider schemaProvider) {
        this(schemaProvider, new PathFullnameResolver(), Clock.systemUTC());
    }

    public SchemaIdentityRegistry(SchemaProvider schemaProvider, FullnameResolver fullnameResolver, Clock clock) {
        this(new HashInputBuilder(schemaProvider, fullnameResolver), new HashComputer(), clock);
    }

    public SchemaIdentityRegistry(@NonNull HashInputBuilder inputBuilder, @NonNull HashComputer hashComputer,
                                  @NonNull Clock clock) {
        this.inputBuilder = inputBuilder;
        this.hashComputer = hashComputer;
        this.clock = clock;
    }

    /**
     * Returns the cached identity hash of the type, computing it on first access.
     */
    public String getOrCreate(@NonNull SchemaType type) {
        String cached = hashes.get(type);
        if (cached != null) {
            return cached;
        }
        return hashes.computeIfAbsent(type, this::createHash);
    }

    /**
     * Evicts this type's hash and report, then recomputes the hash. Only useful after
     * the type's schema was changed at runtime. Other types, including parents and
     * subtypes, keep their entries.
     */
    public String rebuild(@NonNull SchemaType type) {
        hashes.remove(type);
        reports.remove(type);
        log.info("Rebuilding identity hash for {}", type);
        return getOrCreate(type);
    }

    /**
     * Cached report of the type's identity: qualified name, creation time, hash and the
     * hash settings in effect.
     */
    public IdentityReport report(@NonNull SchemaType type) {
        IdentityReport cached = reports.get(type);
        if (cached != null) {
            return cached;
        }
        return reports.computeIfAbsent(type, this::createReport);
    }

    /**
     * The exact bytes handed to the hash function, for debugging. Always freshly built;
     * decode as UTF-8 JSON to inspect.
     */
    public byte[] hashInput(@NonNull SchemaType type) {
        return inputBuilder.build(type);
    }

    public String fullname(@NonNull SchemaType type) {
        return inputBuilder.fullname(type);
    }

    /**
     * Tags a payload with the current identity hash of its type.
     */
    public <T> StampedRecord<T> stamp(@NonNull SchemaType type, T payload) {
        return new StampedRecord<>(type, payload, getOrCreate(type));
    }

    public boolean isCached(@NonNull SchemaType type) {
        return hashes.containsKey(type);
    }

    private String createHash(SchemaType type) {
        HashConfig config = type.getConfig();
        byte[] input = inputBuilder.build(type);
        String hash = hashComputer.hash(input, config.getHashFunction(), config.getHashLimit());
        log.debug("Computed identity hash {} for {}", hash, type);
        return hash;
    }

    private IdentityReport createReport(SchemaType type) {
        return IdentityReport.builder()
                .fullname(fullname(type))
                .createdAt(clock.instant())
                .hash(getOrCreate(type))
                .hashSettings(type.getConfig().toSettings())
                .build();
    }
}

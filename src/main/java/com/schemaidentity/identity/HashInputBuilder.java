package com.schemaidentity.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemaidentity.identity.canonical.CanonicalizationPolicy;
import com.schemaidentity.identity.canonical.SchemaCanonicalizer;
import com.schemaidentity.identity.exception.SchemaSerializationException;
import com.schemaidentity.identity.serialization.EnvelopeSerializer;
import com.schemaidentity.identity.serialization.SchemaValues;
import com.schemaidentity.identity.validation.HashConfigValidator;
import com.schemaidentity.model.Aliasing;
import com.schemaidentity.model.SchemaMode;
import com.schemaidentity.model.SchemaObject;
import com.schemaidentity.model.SchemaType;
import com.schemaidentity.model.SchemaValue;
import com.schemaidentity.model.config.HashConfig;
import com.schemaidentity.provider.FullnameResolver;
import com.schemaidentity.provider.SchemaProvider;

import lombok.NonNull;

/**
 * Builds the exact bytes fed to a type's hash function:
 * <pre>
 * {"name": ..., "schemas": {"ser_by_alias": ..., "ser_by_name": ..., "val_by_alias": ...}, "extra_data": ...}
 * </pre>
 * {@code val_by_alias} is only present when validation-mode tracking is on. Every
 * schema is canonicalized under the type's policy first.
 */
public class HashInputBuilder {

    private static final Logger log = LoggerFactory.getLogger(HashInputBuilder.class);

    static final String NAME = "name";
    static final String SCHEMAS = "schemas";
    static final String EXTRA_DATA = "extra_data";
    static final String SER_BY_ALIAS = "ser_by_alias";
    static final String SER_BY_NAME = "ser_by_name";
    static final String VAL_BY_ALIAS = "val_by_alias";

    private final SchemaProvider schemaProvider;
    private final FullnameResolver fullnameResolver;
    private final HashConfigValidator validator;
    private final SchemaCanonicalizer canonicalizer;
    private final EnvelopeSerializer serializer;

    public HashInputBuilder(@NonNull SchemaProvider schemaProvider, @NonNull FullnameResolver fullnameResolver) {
        this(schemaProvider, fullnameResolver, new HashConfigValidator(), new SchemaCanonicalizer(),
                new EnvelopeSerializer());
    }

    public HashInputBuilder(@NonNull SchemaProvider schemaProvider, @NonNull FullnameResolver fullnameResolver,
                            @NonNull HashConfigValidator validator, @NonNull SchemaCanonicalizer canonicalizer,
                            @NonNull EnvelopeSerializer serializer) {
        this.schemaProvider = schemaProvider;
        this.fullnameResolver = fullnameResolver;
        this.validator = validator;
        this.canonicalizer = canonicalizer;
        this.serializer = serializer;
    }

    public String fullname(@NonNull SchemaType type) {
        return fullnameResolver.resolve(type, type.getConfig().getTrackedFilepathParts());
    }

    /**
     * @throws com.schemaidentity.identity.exception.ConfigConflictException before any schema is generated
     * @throws SchemaSerializationException if the envelope cannot be encoded
     */
    public byte[] build(@NonNull SchemaType type) {
        validator.validate(type);

        HashConfig config = type.getConfig();
        CanonicalizationPolicy policy = CanonicalizationPolicy.from(config);

        SchemaObject.Builder schemas = SchemaObject.builder()
                .put(SER_BY_ALIAS, schema(type, SchemaMode.SERIALIZATION, Aliasing.BY_ALIAS, policy))
                .put(SER_BY_NAME, schema(type, SchemaMode.SERIALIZATION, Aliasing.BY_NAME, policy));
        if (config.isTrackValidationMode()) {
            schemas.put(VAL_BY_ALIAS, schema(type, SchemaMode.VALIDATION, Aliasing.BY_ALIAS, policy));
        }

        String name = fullname(type);
        SchemaObject envelope = SchemaObject.builder()
                .put(NAME, name)
                .put(SCHEMAS, schemas.build())
                .put(EXTRA_DATA, extraData(name, config.getTrackedExtraData()))
                .build();

        byte[] bytes = serializer.serialize(name, envelope, !config.isTrackFieldOrder());
        log.debug("Built {} bytes of hash input for {}", bytes.length, name);
        return bytes;
    }

    private SchemaObject schema(SchemaType type, SchemaMode mode, Aliasing aliasing, CanonicalizationPolicy policy) {
        return canonicalizer.normalize(schemaProvider.generate(type, mode, aliasing), policy);
    }

    private static SchemaValue extraData(String name, Object trackedExtraData) {
        try {
            return SchemaValues.fromObject(trackedExtraData);
        } catch (IllegalArgumentException e) {
            throw new SchemaSerializationException(name, e);
        }
    }
}

package com.schemaidentity.identity;

import com.schemaidentity.model.SchemaType;

import lombok.NonNull;
import lombok.Value;

/**
 * A payload tagged with the identity hash its type had when the payload was produced.
 * Store the hash next to the data; later, {@link #matches} tells whether the schema in
 * use now is the one that produced it.
 */
@Value
public class StampedRecord<T> {

    @NonNull
    SchemaType type;

    T payload;

    @NonNull
    String schemaHash;

    /**
     * Re-attaches a hash read back from storage.
     */
    public static <T> StampedRecord<T> restore(SchemaType type, T payload, String storedHash) {
        return new StampedRecord<>(type, payload, storedHash);
    }

    public boolean matches(@NonNull SchemaIdentityRegistry registry) {
        return schemaHash.equals(registry.getOrCreate(type));
    }
}

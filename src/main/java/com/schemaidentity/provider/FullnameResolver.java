package com.schemaidentity.provider;

import com.schemaidentity.model.SchemaType;

/**
 * Qualified name of a type: up to {@code keepPathParts} trailing segments of its
 * declaring location followed by the bare name, dot-joined. {@code 0} yields the bare
 * name; asking for more segments than exist yields all of them.
 */
@FunctionalInterface
public interface FullnameResolver {

    String resolve(SchemaType type, int keepPathParts);
}

package com.schemaidentity.provider;

import com.schemaidentity.model.Aliasing;
import com.schemaidentity.model.SchemaMode;
import com.schemaidentity.model.SchemaObject;
import com.schemaidentity.model.SchemaType;

/**
 * Produces the schema document of a type. Object keys must follow the type's
 * declared field order.
 */
public interface SchemaProvider {

    SchemaObject generate(SchemaType type, SchemaMode mode, Aliasing aliasing);
}

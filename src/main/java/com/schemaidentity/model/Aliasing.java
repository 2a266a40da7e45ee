package com.schemaidentity.model;

/**
 * Whether field keys in a schema document use the declared alias or the field name.
 */
public enum Aliasing {
    BY_ALIAS,
    BY_NAME
}

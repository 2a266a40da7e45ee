package com.schemaidentity.identity.validation;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.schemaidentity.identity.exception.ConfigConflictException;
import com.schemaidentity.model.SchemaMode;
import com.schemaidentity.model.SchemaType;

class HashConfigValidatorTest {

    private final HashConfigValidator validator = new HashConfigValidator();

    @Test
    void testOverrideWithValidationTrackingFails() {
        SchemaType type = SchemaType.define("Pinned").schemaModeOverride(SchemaMode.VALIDATION).register();

        assertThatThrownBy(() -> validator.validate(type))
                .isInstanceOfSatisfying(ConfigConflictException.class, e -> {
                    assertThat(e.getTypeName()).isEqualTo("Pinned");
                    assertThat(e.getOverride()).isEqualTo(SchemaMode.VALIDATION);
                })
                .hasMessageContaining("trackValidationMode");
    }

    @Test
    void testOverrideWithoutValidationTrackingPasses() {
        SchemaType type = SchemaType.define("Pinned")
                .schemaModeOverride(SchemaMode.SERIALIZATION)
                .configure(c -> c.trackValidationMode(false))
                .register();

        assertThatCode(() -> validator.validate(type)).doesNotThrowAnyException();
    }

    @Test
    void testNoOverridePasses() {
        assertThatCode(() -> validator.validate(SchemaType.define("Plain").register())).doesNotThrowAnyException();
    }

    @Test
    void testOverrideIsInheritedBySubtypes() {
        SchemaType parent = SchemaType.define("Parent")
                .schemaModeOverride(SchemaMode.SERIALIZATION)
                .configure(c -> c.trackValidationMode(false))
                .register();
        SchemaType child = parent.extend("Child").configure(c -> c.trackValidationMode(true)).register();

        assertThatThrownBy(() -> validator.validate(child)).isInstanceOf(ConfigConflictException.class);
    }
}

package com.schemaidentity.model;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for the schema document tree.
 */
class SchemaValueTest {

    @Test
    void testStringTextIsRaw() {
        SchemaString value = SchemaValue.string("say \"hi\"");

        assertThat(value.asText()).isEqualTo("say \"hi\"");
        assertThat(value.toJson()).isEqualTo("\"say \\\"hi\\\"\"");
    }

    @Test
    void testNonStringTextIsCompactJson() {
        SchemaObject doc = SchemaObject.builder()
                .put("b", SchemaValue.array(SchemaValue.number(1), SchemaValue.bool(false), SchemaValue.nullValue()))
                .put("a", "x")
                .build();

        assertThat(doc.asText()).isEqualTo("{\"b\":[1,false,null],\"a\":\"x\"}");
        assertThat(SchemaValue.number(2.5).asText()).isEqualTo("2.5");
        assertThat(SchemaValue.bool(true).asText()).isEqualTo("true");
        assertThat(SchemaValue.nullValue().asText()).isEqualTo("null");
    }

    @Test
    void testBuilderReplacesKeyInPlace() {
        SchemaObject doc = SchemaObject.builder().put("a", 1).put("b", 2).put("a", 3).build();

        assertThat(doc.keys()).containsExactly("a", "b");
        assertThat(doc.get("a")).isEqualTo(SchemaValue.number(3));
    }

    @Test
    void testObjectIsImmutable() {
        SchemaObject doc = SchemaObject.builder().put("a", 1).build();

        assertThatThrownBy(() -> doc.getEntries().put("b", SchemaValue.nullValue()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testNonFiniteNumbers() {
        assertThat(SchemaValue.number(Double.NaN).isFinite()).isFalse();
        assertThat(SchemaValue.number(Float.NEGATIVE_INFINITY).isFinite()).isFalse();
        assertThat(SchemaValue.number(1e300).isFinite()).isTrue();
    }

    @Test
    void testVisitorDispatch() {
        SchemaValueVisitor<String> kind = new SchemaValueVisitor<>() {
            @Override
            public String visit(SchemaObject object) {
                return "object";
            }

            @Override
            public String visit(SchemaArray array) {
                return "array";
            }

            @Override
            public String visit(SchemaString string) {
                return "string";
            }

            @Override
            public String visit(SchemaNumber number) {
                return "number";
            }

            @Override
            public String visit(SchemaBoolean bool) {
                return "boolean";
            }

            @Override
            public String visit(SchemaNull nul) {
                return "null";
            }
        };

        assertThat(SchemaObject.empty().accept(kind)).isEqualTo("object");
        assertThat(SchemaValue.array().accept(kind)).isEqualTo("array");
        assertThat(SchemaValue.string("").accept(kind)).isEqualTo("string");
        assertThat(SchemaValue.number(0).accept(kind)).isEqualTo("number");
        assertThat(SchemaValue.bool(true).accept(kind)).isEqualTo("boolean");
        assertThat(SchemaValue.nullValue().accept(kind)).isEqualTo("null");
    }
}

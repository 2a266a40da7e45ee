package com.schemaidentity.identity.serialization;

import static org.assertj.core.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemaidentity.model.SchemaNull;
import com.schemaidentity.model.SchemaNumber;
import com.schemaidentity.model.SchemaObject;
import com.schemaidentity.model.SchemaValue;

class SchemaValuesTest {

    @Test
    void testNullBecomesJsonNull() {
        assertThat(SchemaValues.fromObject(null)).isInstanceOf(SchemaNull.class);
    }

    @Test
    void testSchemaValuePassesThrough() {
        SchemaObject doc = SchemaObject.builder().put("a", 1).build();

        assertThat(SchemaValues.fromObject(doc)).isSameAs(doc);
    }

    @Test
    void testMapsAndListsConvertInOrder() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("z", List.of("a", 1, true));
        data.put("a", null);

        SchemaValue value = SchemaValues.fromObject(data);

        assertThat(value.toJson()).isEqualTo("{\"z\":[\"a\",1,true],\"a\":null}");
    }

    @Test
    void testNaNSurvivesAsNonFiniteNumber() {
        SchemaValue value = SchemaValues.fromObject(Double.NaN);

        assertThat(value).isInstanceOf(SchemaNumber.class);
        assertThat(((SchemaNumber) value).isFinite()).isFalse();
    }

    @Test
    void testUnserializableObjectFails() {
        assertThatThrownBy(() -> SchemaValues.fromObject(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testObjectFromJsonNodeRequiresObject() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(SchemaValues.objectFromJsonNode(mapper.readTree("{\"type\":\"object\"}")).get("type").asText())
                .isEqualTo("object");
        assertThatThrownBy(() -> SchemaValues.objectFromJsonNode(mapper.readTree("[1]")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ARRAY");
    }
}

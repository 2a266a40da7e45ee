package com.schemaidentity.identity.serialization;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemaidentity.model.SchemaObject;
import com.schemaidentity.model.SchemaValue;

import lombok.experimental.UtilityClass;

/**
 * Conversions between Jackson trees / plain Java objects and schema documents.
 */
@UtilityClass
public class SchemaValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Converts any Jackson-serializable object (maps, lists, scalars, beans) into a
     * document tree. {@code null} becomes JSON null.
     *
     * @throws IllegalArgumentException if Jackson cannot serialize the value
     */
    public static SchemaValue fromObject(Object value) {
        if (value == null) {
            return SchemaValue.nullValue();
        }
        if (value instanceof SchemaValue schemaValue) {
            return schemaValue;
        }
        JsonNode tree = MAPPER.valueToTree(value);
        return fromJsonNode(tree);
    }

    public static SchemaValue fromJsonNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return SchemaValue.nullValue();
        }
        if (node.isObject()) {
            SchemaObject.Builder builder = SchemaObject.builder();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.put(field.getKey(), fromJsonNode(field.getValue()));
            }
            return builder.build();
        }
        if (node.isArray()) {
            List<SchemaValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromJsonNode(element));
            }
            return SchemaValue.array(elements);
        }
        if (node.isBoolean()) {
            return SchemaValue.bool(node.booleanValue());
        }
        if (node.isNumber()) {
            return SchemaValue.number(node.numberValue());
        }
        if (node.isTextual()) {
            return SchemaValue.string(node.textValue());
        }
        // binary and POJO nodes
        return SchemaValue.string(node.asText());
    }

    /**
     * Like {@link #fromJsonNode} but requires a JSON object at the root.
     */
    public static SchemaObject objectFromJsonNode(JsonNode node) {
        SchemaValue value = fromJsonNode(node);
        if (!(value instanceof SchemaObject object)) {
            throw new IllegalArgumentException("Expected a JSON object but got: " + node.getNodeType());
        }
        return object;
    }
}

package io.github.superyaml.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;

/// Converts between JSON text and {@link Value} trees using Jackson.
///
/// Output is deterministic: object members are written in insertion order,
/// integers without a fraction and decimals in `Double.toString` form.
public final class ValueJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson() {}

    /// Reads JSON text.
    /// @throws ValueFormatException if the text is not valid JSON
    public static Value parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return fromNode(MAPPER.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new ValueFormatException("invalid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    /// Writes a value as JSON text.
    /// @param pretty `true` for indented output
    public static String write(Value value, boolean pretty) {
        Objects.requireNonNull(value, "value must not be null");
        try {
            final var node = toNode(value);
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new ValueFormatException("failed to write JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    static Value fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.of();
        }
        if (node.isObject()) {
            final var members = new LinkedHashMap<String, Value>();
            node.fields().forEachRemaining(e -> members.put(e.getKey(), fromNode(e.getValue())));
            return new ObjectValue(members);
        }
        if (node.isArray()) {
            final var elements = new ArrayList<Value>(node.size());
            node.forEach(child -> elements.add(fromNode(child)));
            return new ArrayValue(elements);
        }
        if (node.isBoolean()) {
            return BoolValue.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? new IntegerValue(node.longValue()) : new DecimalValue(node.doubleValue());
        }
        if (node.isNumber()) {
            return new DecimalValue(node.doubleValue());
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        throw new ValueFormatException("unsupported JSON node: " + node.getNodeType(), null);
    }

    static JsonNode toNode(Value value) {
        if (value instanceof NullValue) {
            return NODES.nullNode();
        }
        if (value instanceof BoolValue b) {
            return NODES.booleanNode(b.value());
        }
        if (value instanceof IntegerValue i) {
            return NODES.numberNode(i.value());
        }
        if (value instanceof DecimalValue d) {
            return NODES.numberNode(d.value());
        }
        if (value instanceof StringValue s) {
            return NODES.textNode(s.value());
        }
        if (value instanceof ArrayValue arr) {
            final ArrayNode out = NODES.arrayNode(arr.elements().size());
            arr.elements().forEach(e -> out.add(toNode(e)));
            return out;
        }
        final ObjectNode out = NODES.objectNode();
        ((ObjectValue) value).members().forEach((k, v) -> out.set(k, toNode(v)));
        return out;
    }
}

package work.lcod.scals.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Jackson bridge for {@link JsonValue} plus the comparison rules shared by the store and evaluator.
 */
public final class JsonValues {
    private static final ObjectMapper JSON = new ObjectMapper();

    private JsonValues() {}

    public static JsonValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JsonValue.NULL;
        }
        if (node.isBoolean()) {
            return JsonValue.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return JsonValue.of(node.longValue());
        }
        if (node.isNumber()) {
            return JsonValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return JsonValue.of(node.textValue());
        }
        if (node.isArray()) {
            var items = new ArrayList<JsonValue>(node.size());
            node.forEach(child -> items.add(fromNode(child)));
            return JsonValue.array(items);
        }
        if (node.isObject()) {
            var fields = new LinkedHashMap<String, JsonValue>();
            node.fields().forEachRemaining(entry -> fields.put(entry.getKey(), fromNode(entry.getValue())));
            return JsonValue.object(fields);
        }
        return JsonValue.of(node.asText());
    }

    public static JsonNode toNode(JsonValue value) {
        var factory = JsonNodeFactory.instance;
        if (value instanceof JsonValue.BoolValue b) return factory.booleanNode(b.value());
        if (value instanceof JsonValue.IntValue i) return factory.numberNode(i.value());
        if (value instanceof JsonValue.DoubleValue d) return factory.numberNode(d.value());
        if (value instanceof JsonValue.StringValue s) return factory.textNode(s.value());
        if (value instanceof JsonValue.ArrayValue a) {
            ArrayNode array = factory.arrayNode();
            a.items().forEach(item -> array.add(toNode(item)));
            return array;
        }
        if (value instanceof JsonValue.ObjectValue o) {
            ObjectNode object = factory.objectNode();
            o.fields().forEach((k, v) -> object.set(k, toNode(v)));
            return object;
        }
        return factory.nullNode();
    }

    public static String toJsonString(JsonValue value) {
        try {
            return JSON.writeValueAsString(toNode(value));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize value", ex);
        }
    }

    public static JsonValue parse(String json) {
        try {
            return fromNode(JSON.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Equality used for array membership: integers and doubles compare numerically.
     */
    public static boolean looselyEquals(JsonValue left, JsonValue right) {
        if (left.asDouble().isPresent() && right.asDouble().isPresent()) {
            return left.asDouble().get().doubleValue() == right.asDouble().get().doubleValue();
        }
        return left.equals(right);
    }

    public static boolean isTruthy(JsonValue value) {
        return value.asBoolean().orElse(false);
    }
}

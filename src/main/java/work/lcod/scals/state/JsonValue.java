package work.lcod.scals.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed set of dynamically-typed values held by the state store and produced by expressions.
 *
 * <p>Conversions are lenient: asking for a type the value does not hold yields an empty result
 * instead of failing.
 */
public sealed interface JsonValue
    permits JsonValue.NullValue, JsonValue.BoolValue, JsonValue.IntValue, JsonValue.DoubleValue,
        JsonValue.StringValue, JsonValue.ArrayValue, JsonValue.ObjectValue {

    NullValue NULL = NullValue.INSTANCE;
    BoolValue TRUE = new BoolValue(true);
    BoolValue FALSE = new BoolValue(false);

    static JsonValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static JsonValue of(long value) {
        return new IntValue(value);
    }

    static JsonValue of(double value) {
        return new DoubleValue(value);
    }

    static JsonValue of(String value) {
        return value == null ? NULL : new StringValue(value);
    }

    static ArrayValue array(List<JsonValue> items) {
        return new ArrayValue(items);
    }

    static ObjectValue object(Map<String, JsonValue> fields) {
        return new ObjectValue(fields);
    }

    /**
     * Converts plain Java values (maps, lists, boxed scalars) into a {@link JsonValue}.
     */
    static JsonValue from(Object raw) {
        if (raw == null) return NULL;
        if (raw instanceof JsonValue value) return value;
        if (raw instanceof Boolean b) return of(b);
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof Number n) return of(n.doubleValue());
        if (raw instanceof CharSequence s) return of(s.toString());
        if (raw instanceof Map<?, ?> map) {
            var fields = new LinkedHashMap<String, JsonValue>();
            map.forEach((k, v) -> fields.put(String.valueOf(k), from(v)));
            return new ObjectValue(fields);
        }
        if (raw instanceof Iterable<?> iterable) {
            var items = new ArrayList<JsonValue>();
            iterable.forEach(item -> items.add(from(item)));
            return new ArrayValue(items);
        }
        return of(raw.toString());
    }

    default boolean isNull() {
        return this instanceof NullValue;
    }

    default Optional<Boolean> asBoolean() {
        return this instanceof BoolValue b ? Optional.of(b.value()) : Optional.empty();
    }

    default Optional<Long> asLong() {
        return this instanceof IntValue i ? Optional.of(i.value()) : Optional.empty();
    }

    /** Numeric view accepting both integer and double values. */
    default Optional<Double> asDouble() {
        if (this instanceof IntValue i) return Optional.of((double) i.value());
        if (this instanceof DoubleValue d) return Optional.of(d.value());
        return Optional.empty();
    }

    default Optional<String> asString() {
        return this instanceof StringValue s ? Optional.of(s.value()) : Optional.empty();
    }

    default Optional<List<JsonValue>> asArray() {
        return this instanceof ArrayValue a ? Optional.of(a.items()) : Optional.empty();
    }

    default Optional<Map<String, JsonValue>> asObject() {
        return this instanceof ObjectValue o ? Optional.of(o.fields()) : Optional.empty();
    }

    /**
     * Text used when the value is substituted into a template. Null renders as the empty string.
     */
    default String displayString() {
        if (this instanceof NullValue) return "";
        if (this instanceof StringValue s) return s.value();
        if (this instanceof BoolValue b) return Boolean.toString(b.value());
        if (this instanceof IntValue i) return Long.toString(i.value());
        if (this instanceof DoubleValue d) return Double.toString(d.value());
        return JsonValues.toJsonString(this);
    }

    /**
     * Unwraps into plain Java values (LinkedHashMap, ArrayList, Long, Double, String, Boolean, null).
     */
    default Object toJava() {
        if (this instanceof NullValue) return null;
        if (this instanceof BoolValue b) return b.value();
        if (this instanceof IntValue i) return i.value();
        if (this instanceof DoubleValue d) return d.value();
        if (this instanceof StringValue s) return s.value();
        if (this instanceof ArrayValue a) {
            var list = new ArrayList<Object>(a.items().size());
            a.items().forEach(item -> list.add(item.toJava()));
            return list;
        }
        var map = new LinkedHashMap<String, Object>();
        ((ObjectValue) this).fields().forEach((k, v) -> map.put(k, v.toJava()));
        return map;
    }

    enum NullValue implements JsonValue {
        INSTANCE;

        @Override
        public String toString() {
            return "null";
        }
    }

    record BoolValue(boolean value) implements JsonValue {}

    record IntValue(long value) implements JsonValue {}

    record DoubleValue(double value) implements JsonValue {}

    record StringValue(String value) implements JsonValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record ArrayValue(List<JsonValue> items) implements JsonValue {
        public ArrayValue {
            items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        public int size() {
            return items.size();
        }

        public JsonValue get(int index) {
            return index >= 0 && index < items.size() ? items.get(index) : NULL;
        }
    }

    record ObjectValue(Map<String, JsonValue> fields) implements JsonValue {
        public static final ObjectValue EMPTY = new ObjectValue(Map.of());

        public ObjectValue {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        public JsonValue get(String key) {
            var value = fields.get(key);
            return value == null ? NULL : value;
        }
    }
}

package work.lcod.scals.state;

import java.util.Objects;

/**
 * Opaque copy of a store's contents. The JSON form is a convenience; hosts pick their own storage.
 */
public record StateSnapshot(JsonValue.ObjectValue values) {
    public StateSnapshot {
        Objects.requireNonNull(values, "values");
    }

    public String toJson() {
        return JsonValues.toJsonString(values);
    }

    public static StateSnapshot fromJson(String json) {
        var parsed = JsonValues.parse(json);
        if (!(parsed instanceof JsonValue.ObjectValue object)) {
            throw new IllegalArgumentException("State snapshot must be a JSON object");
        }
        return new StateSnapshot(object);
    }
}

package work.lcod.scals.document;

import java.util.Objects;
import work.lcod.scals.state.JsonValue;

/**
 * Loosely-typed action as written in a document: {@code {"type": "...", ...parameters}}.
 */
public record DocumentAction(String type, JsonValue.ObjectValue parameters) {
    public DocumentAction {
        Objects.requireNonNull(type, "type");
        parameters = parameters == null ? JsonValue.ObjectValue.EMPTY : parameters;
    }

    public JsonValue parameter(String key) {
        return parameters.get(key);
    }
}

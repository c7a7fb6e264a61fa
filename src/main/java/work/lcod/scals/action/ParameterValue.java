package work.lcod.scals.action;

import work.lcod.scals.state.ExpressionEvaluator;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.state.StateReader;

/**
 * Action parameter that is either a literal or an expression evaluated when the action runs.
 * Written as a plain value, as a string containing {@code ${...}}, or as {@code {"$expr": "..."}}.
 */
public record ParameterValue(JsonValue literal, String expression) {
    public static ParameterValue from(JsonValue raw) {
        if (raw instanceof JsonValue.ObjectValue object && object.get("$expr") instanceof JsonValue.StringValue expr) {
            return new ParameterValue(null, expr.value());
        }
        if (raw instanceof JsonValue.StringValue text && ExpressionEvaluator.containsExpression(text.value())) {
            return new ParameterValue(null, text.value());
        }
        return new ParameterValue(raw == null ? JsonValue.NULL : raw, null);
    }

    public static ParameterValue literal(JsonValue value) {
        return new ParameterValue(value, null);
    }

    public boolean isExpression() {
        return expression != null;
    }

    public JsonValue evaluate(StateReader reader) {
        return expression == null ? literal : ExpressionEvaluator.evaluate(expression, reader);
    }
}

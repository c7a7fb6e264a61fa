package work.lcod.scals.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {
    private static StateReader state(Map<String, Object> values) {
        var store = new StateStore();
        values.forEach(store::set);
        return store;
    }

    @Test
    void arithmeticAppliesOneBinaryStep() {
        assertEquals(JsonValue.of(8L), ExpressionEvaluator.evaluate("${count} + 3", state(Map.of("count", 5))));
        assertEquals(JsonValue.of(10L), ExpressionEvaluator.evaluate("${count} * 2", state(Map.of("count", 5))));
        assertEquals(JsonValue.of(2.5), ExpressionEvaluator.evaluate("${price} / 2", state(Map.of("price", 5.0))));
    }

    @Test
    void subtractionIsNotClamped() {
        assertEquals(JsonValue.of(-1L), ExpressionEvaluator.evaluate("${count} - 1", state(Map.of("count", 0))));
    }

    @Test
    void absentOperandCountsAsZero() {
        assertEquals(JsonValue.of(1L), ExpressionEvaluator.evaluate("${missing} + 1", state(Map.of())));
    }

    @Test
    void divisionByZeroYieldsNull() {
        assertTrue(ExpressionEvaluator.evaluate("${count} / 0", state(Map.of("count", 4))).isNull());
    }

    @Test
    void interpolatesTemplates() {
        assertEquals("Hello John!", ExpressionEvaluator.interpolate("Hello ${name}!", state(Map.of("name", "John"))));
        assertEquals("Hello !", ExpressionEvaluator.interpolate("Hello ${name}!", state(Map.of())));
        assertEquals("2 of 3", ExpressionEvaluator.interpolate("${done} of ${items.count}",
            state(Map.of("done", 2, "items", List.of("a", "b", "c")))));
    }

    @Test
    void plainTextPassesThroughInterpolation() {
        assertEquals("no bindings here", ExpressionEvaluator.interpolate("no bindings here", state(Map.of())));
        assertEquals("", ExpressionEvaluator.interpolate(null, state(Map.of())));
    }

    @Test
    void arrayAccessors() {
        var reader = state(Map.of("items", List.of("a", "b", "c"), "tags", List.of("swift", "ios")));
        assertEquals(JsonValue.of(3L), ExpressionEvaluator.evaluate("items.count", reader));
        assertEquals(JsonValue.FALSE, ExpressionEvaluator.evaluate("items.isEmpty", reader));
        assertEquals(JsonValue.of("a"), ExpressionEvaluator.evaluate("items.first", reader));
        assertEquals(JsonValue.of("c"), ExpressionEvaluator.evaluate("items.last", reader));
        assertEquals(JsonValue.TRUE, ExpressionEvaluator.evaluate("tags.contains('ios')", reader));
        assertEquals(JsonValue.FALSE, ExpressionEvaluator.evaluate("tags.contains('android')", reader));
    }

    @Test
    void accessorsOnAbsentArrays() {
        var reader = state(Map.of());
        assertEquals(JsonValue.of(0L), ExpressionEvaluator.evaluate("items.count", reader));
        assertEquals(JsonValue.TRUE, ExpressionEvaluator.evaluate("items.isEmpty", reader));
    }

    @Test
    void ternarySelectsBranch() {
        assertEquals(JsonValue.of("Done"), ExpressionEvaluator.evaluate("finished ? 'Done' : 'Pending'", state(Map.of("finished", true))));
        assertEquals(JsonValue.of("Pending"), ExpressionEvaluator.evaluate("finished ? 'Done' : 'Pending'", state(Map.of("finished", false))));
        assertEquals(JsonValue.of("Pending"), ExpressionEvaluator.evaluate("!finished ? 'Pending' : 'Done'", state(Map.of("finished", false))));
    }

    @Test
    void conditionsAreStrictlyBoolean() {
        var reader = state(Map.of("flag", true, "text", "true"));
        assertTrue(ExpressionEvaluator.evaluateCondition("flag", reader));
        assertFalse(ExpressionEvaluator.evaluateCondition("!flag", reader));
        assertFalse(ExpressionEvaluator.evaluateCondition("text", reader));
        assertFalse(ExpressionEvaluator.evaluateCondition("missing", reader));
    }

    @Test
    void unrecognizedExpressionsDegradeToNull() {
        assertTrue(ExpressionEvaluator.evaluate("1 + 2 + 3 ???", state(Map.of())).isNull());
        assertTrue(ExpressionEvaluator.evaluate("", state(Map.of())).isNull());
    }

    @Test
    void templatePathsListsPlainReferences() {
        assertEquals(List.of("user.name", "count"), ExpressionEvaluator.templatePaths("${user.name} has ${count} (${count} + 1)"));
    }
}

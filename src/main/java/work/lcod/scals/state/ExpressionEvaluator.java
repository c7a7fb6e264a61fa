package work.lcod.scals.state;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the small expression language used by documents for bindings and action parameters.
 *
 * <p>Recognized forms:
 * <ul>
 *   <li>{@code ${path} + 1}, {@code ${path} - 1} and the other single binary steps ({@code * / %})</li>
 *   <li>{@code cond ? 'a' : 'b'} where {@code cond} is a path, {@code !path}, {@code true},
 *       {@code false} or an array predicate</li>
 *   <li>{@code path.count}, {@code path.isEmpty}, {@code path.first}, {@code path.last},
 *       {@code path.contains(x)}</li>
 *   <li>{@code ${path}}, literals and bare paths</li>
 * </ul>
 * Anything else evaluates to {@link JsonValue#NULL}. Evaluation never throws.
 */
public final class ExpressionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final String PATH = "[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z0-9_]+|\\[\\d+\\])*";
    private static final String NUMBER = "-?\\d+(?:\\.\\d+)?";
    private static final String OPERAND = "\\$\\{[^}]+\\}|" + PATH + "|" + NUMBER;

    private static final Pattern TEMPLATE = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final Pattern PATH_PATTERN = Pattern.compile(PATH);
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");
    private static final Pattern ACCESSOR = Pattern.compile("(" + PATH + ")\\.(count|isEmpty|first|last)");
    private static final Pattern CONTAINS = Pattern.compile("(" + PATH + ")\\.contains\\((.*)\\)");
    private static final Pattern ARITHMETIC =
        Pattern.compile("(" + OPERAND + ")\\s*([+\\-*/%])\\s*(" + OPERAND + ")");

    private ExpressionEvaluator() {}

    public static boolean containsExpression(String value) {
        return value != null && value.contains("${") && value.contains("}");
    }

    /** True when the whole (trimmed) string is exactly one {@code ${...}} span. */
    public static boolean isPureExpression(String value) {
        if (value == null) {
            return false;
        }
        var trimmed = value.trim();
        return trimmed.startsWith("${")
            && trimmed.endsWith("}")
            && trimmed.indexOf('}') == trimmed.length() - 1;
    }

    public static String unwrapExpression(String value) {
        if (!isPureExpression(value)) {
            return value;
        }
        var trimmed = value.trim();
        return trimmed.substring(2, trimmed.length() - 1).trim();
    }

    /** State paths referenced by plain {@code ${path}} spans, in order of appearance. */
    public static List<String> templatePaths(String template) {
        if (!containsExpression(template)) {
            return List.of();
        }
        var paths = new ArrayList<String>();
        Matcher matcher = TEMPLATE.matcher(template);
        while (matcher.find()) {
            var inner = matcher.group(1).trim();
            if (PATH_PATTERN.matcher(inner).matches() && !paths.contains(inner)) {
                paths.add(inner);
            }
        }
        return paths;
    }

    public static String interpolate(String template, StateReader reader) {
        if (template == null || !containsExpression(template)) {
            return template == null ? "" : template;
        }
        Matcher matcher = TEMPLATE.matcher(template);
        var out = new StringBuilder();
        while (matcher.find()) {
            var replacement = evaluate(matcher.group(1), reader).displayString();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public static JsonValue evaluate(String expression, StateReader reader) {
        if (expression == null || expression.isBlank()) {
            return JsonValue.NULL;
        }
        var expr = expression.trim();
        if (isPureExpression(expr)) {
            return evaluate(unwrapExpression(expr), reader);
        }
        var ternary = splitTernary(expr);
        if (ternary != null) {
            return evaluateTernary(ternary, reader);
        }
        var arithmetic = ARITHMETIC.matcher(expr);
        if (arithmetic.matches()) {
            return evaluateArithmetic(arithmetic.group(1), arithmetic.group(2), arithmetic.group(3), reader);
        }
        var accessor = ACCESSOR.matcher(expr);
        if (accessor.matches()) {
            return evaluateAccessor(accessor.group(1), accessor.group(2), expr, reader);
        }
        var contains = CONTAINS.matcher(expr);
        if (contains.matches()) {
            return evaluateContains(contains.group(1), contains.group(2), reader);
        }
        if (containsExpression(expr)) {
            return JsonValue.of(interpolate(expr, reader));
        }
        var literal = parseLiteral(expr);
        if (literal != null) {
            return literal;
        }
        if (expr.startsWith("!") && PATH_PATTERN.matcher(expr.substring(1).trim()).matches()) {
            return JsonValue.of(!JsonValues.isTruthy(reader.read(expr.substring(1).trim())));
        }
        if (PATH_PATTERN.matcher(expr).matches()) {
            return reader.read(expr);
        }
        log.debug("Unrecognized expression '{}'", expression);
        return JsonValue.NULL;
    }

    /** Evaluates a condition; anything but boolean {@code true} is false. */
    public static boolean evaluateCondition(String condition, StateReader reader) {
        var trimmed = condition == null ? "" : condition.trim();
        if (trimmed.startsWith("!")) {
            return !evaluateCondition(trimmed.substring(1), reader);
        }
        return JsonValues.isTruthy(evaluate(trimmed, reader));
    }

    private static JsonValue evaluateTernary(List<String> parts, StateReader reader) {
        var branch = evaluateCondition(parts.get(0), reader) ? parts.get(1) : parts.get(2);
        var unquoted = unquote(branch.trim());
        return unquoted != null ? JsonValue.of(unquoted) : evaluate(branch, reader);
    }

    private static JsonValue evaluateArithmetic(String leftToken, String operator, String rightToken, StateReader reader) {
        var left = operand(leftToken, reader);
        var right = operand(rightToken, reader);
        if (left == null || right == null) {
            log.debug("Non-numeric operand in '{} {} {}'", leftToken, operator, rightToken);
            return JsonValue.NULL;
        }
        if (left instanceof JsonValue.IntValue l && right instanceof JsonValue.IntValue r) {
            long a = l.value();
            long b = r.value();
            switch (operator) {
                case "+":
                    return JsonValue.of(a + b);
                case "-":
                    return JsonValue.of(a - b);
                case "*":
                    return JsonValue.of(a * b);
                default:
                    if (b == 0) {
                        log.debug("Division by zero in '{} {} {}'", leftToken, operator, rightToken);
                        return JsonValue.NULL;
                    }
                    return JsonValue.of("/".equals(operator) ? a / b : a % b);
            }
        }
        double a = left.asDouble().orElse(0d);
        double b = right.asDouble().orElse(0d);
        switch (operator) {
            case "+":
                return JsonValue.of(a + b);
            case "-":
                return JsonValue.of(a - b);
            case "*":
                return JsonValue.of(a * b);
            case "/":
                return b == 0 ? JsonValue.NULL : JsonValue.of(a / b);
            default:
                return b == 0 ? JsonValue.NULL : JsonValue.of(a % b);
        }
    }

    // Absent operands count as integer zero; other non-numbers abort the step.
    private static JsonValue operand(String token, StateReader reader) {
        JsonValue value;
        if (isPureExpression(token)) {
            value = evaluate(unwrapExpression(token), reader);
        } else if (INTEGER.matcher(token).matches() || DECIMAL.matcher(token).matches()) {
            value = parseLiteral(token);
        } else {
            value = evaluate(token, reader);
        }
        if (value == null || value.isNull()) {
            return JsonValue.of(0L);
        }
        return value.asDouble().isPresent() ? value : null;
    }

    private static JsonValue evaluateAccessor(String path, String accessor, String fullPath, StateReader reader) {
        var base = reader.read(path);
        if (base instanceof JsonValue.ArrayValue array) {
            switch (accessor) {
                case "count":
                    return JsonValue.of((long) array.size());
                case "isEmpty":
                    return JsonValue.of(array.size() == 0);
                case "first":
                    return array.get(0);
                default:
                    return array.get(array.size() - 1);
            }
        }
        if (base.isNull()) {
            switch (accessor) {
                case "count":
                    return JsonValue.of(0L);
                case "isEmpty":
                    return JsonValue.TRUE;
                default:
                    return JsonValue.NULL;
            }
        }
        return reader.read(fullPath);
    }

    private static JsonValue evaluateContains(String path, String argument, StateReader reader) {
        var base = reader.read(path);
        if (!(base instanceof JsonValue.ArrayValue array)) {
            return JsonValue.FALSE;
        }
        var arg = argument.trim();
        var needle = parseLiteral(arg);
        if (needle == null) {
            needle = PATH_PATTERN.matcher(arg).matches() ? reader.read(arg) : JsonValue.NULL;
        }
        final var target = needle;
        return JsonValue.of(array.items().stream().anyMatch(item -> JsonValues.looselyEquals(item, target)));
    }

    private static JsonValue parseLiteral(String token) {
        var unquoted = unquote(token);
        if (unquoted != null) {
            return JsonValue.of(unquoted);
        }
        if ("true".equals(token)) return JsonValue.TRUE;
        if ("false".equals(token)) return JsonValue.FALSE;
        if ("null".equals(token)) return JsonValue.NULL;
        try {
            if (INTEGER.matcher(token).matches()) {
                return JsonValue.of(Long.parseLong(token));
            }
            if (DECIMAL.matcher(token).matches()) {
                return JsonValue.of(Double.parseDouble(token));
            }
        } catch (NumberFormatException ex) {
            log.debug("Numeric literal out of range '{}'", token);
            return JsonValue.NULL;
        }
        return null;
    }

    private static String unquote(String token) {
        if (token.length() >= 2) {
            char first = token.charAt(0);
            char last = token.charAt(token.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return token.substring(1, token.length() - 1);
            }
        }
        return null;
    }

    // Splits "cond ? a : b" on the first '?' and the following ':' found outside quotes.
    private static List<String> splitTernary(String expr) {
        int question = indexOutsideQuotes(expr, '?', 0);
        if (question < 0) {
            return null;
        }
        int colon = indexOutsideQuotes(expr, ':', question + 1);
        if (colon < 0) {
            return null;
        }
        var condition = expr.substring(0, question).trim();
        var bare = condition.startsWith("!") ? condition.substring(1).trim() : condition;
        boolean conditionShape = "true".equals(bare)
            || "false".equals(bare)
            || PATH_PATTERN.matcher(bare).matches()
            || isPureExpression(bare)
            || ACCESSOR.matcher(bare).matches()
            || CONTAINS.matcher(bare).matches();
        if (!conditionShape) {
            return null;
        }
        return List.of(condition, expr.substring(question + 1, colon), expr.substring(colon + 1));
    }

    private static int indexOutsideQuotes(String text, char target, int from) {
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == target) {
                return i;
            }
        }
        return -1;
    }
}

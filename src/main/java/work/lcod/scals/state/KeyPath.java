package work.lcod.scals.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Dot-delimited path into nested objects and arrays. {@code items[0].name} and
 * {@code items.0.name} address the same value and share one canonical form.
 */
public record KeyPath(List<String> segments) {
    public static final KeyPath ROOT = new KeyPath(List.of());

    public KeyPath {
        segments = List.copyOf(segments);
    }

    public static KeyPath parse(String path) {
        if (path == null || path.isBlank()) {
            return ROOT;
        }
        var parts = new ArrayList<String>();
        var current = new StringBuilder();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '.' || c == '[' || c == ']') {
                if (current.length() > 0) {
                    parts.add(current.toString().trim());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString().trim());
        }
        return new KeyPath(parts);
    }

    public static String canonical(String path) {
        return parse(path).toString();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public String head() {
        return segments.isEmpty() ? "" : segments.get(0);
    }

    public KeyPath tail() {
        return segments.isEmpty() ? ROOT : new KeyPath(segments.subList(1, segments.size()));
    }

    public KeyPath parent() {
        return segments.isEmpty() ? ROOT : new KeyPath(segments.subList(0, segments.size() - 1));
    }

    public KeyPath child(String segment) {
        var next = new ArrayList<>(segments);
        next.add(segment);
        return new KeyPath(next);
    }

    /** Ancestors from the nearest parent up to (excluding) the root. */
    public List<KeyPath> ancestors() {
        var result = new ArrayList<KeyPath>();
        var current = parent();
        while (!current.isRoot()) {
            result.add(current);
            current = current.parent();
        }
        return result;
    }

    public boolean startsWith(KeyPath prefix) {
        if (prefix.segments.size() > segments.size()) {
            return false;
        }
        return segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    /** True when one path equals, contains or is contained by the other. */
    public boolean overlaps(KeyPath other) {
        return startsWith(other) || other.startsWith(this);
    }

    public JsonValue get(JsonValue root) {
        JsonValue current = root;
        for (var segment : segments) {
            if (current instanceof JsonValue.ObjectValue object) {
                current = object.get(segment);
            } else if (current instanceof JsonValue.ArrayValue array) {
                current = array.get(parseIndex(segment));
            } else {
                return JsonValue.NULL;
            }
        }
        return current;
    }

    /**
     * Returns a copy of {@code root} with {@code value} stored at this path. Missing intermediate
     * containers are created. A numeric segment under an array addresses an existing item or the
     * append position; any other index leaves {@code root} untouched and returns it as is.
     */
    public JsonValue set(JsonValue root, JsonValue value) {
        if (segments.isEmpty()) {
            return value;
        }
        var segment = head();
        var rest = tail();
        if (root instanceof JsonValue.ArrayValue array) {
            int index = parseIndex(segment);
            if (index < 0 || index > array.size()) {
                return root;
            }
            var items = new ArrayList<>(array.items());
            var existing = index < items.size() ? items.get(index) : JsonValue.NULL;
            var updated = rest.set(existing, value);
            if (updated == existing) {
                return root;
            }
            if (index == items.size()) {
                items.add(updated);
            } else {
                items.set(index, updated);
            }
            return JsonValue.array(items);
        }
        var fields = root instanceof JsonValue.ObjectValue object
            ? new LinkedHashMap<>(object.fields())
            : new LinkedHashMap<String, JsonValue>();
        var existing = fields.getOrDefault(segment, JsonValue.NULL);
        if (existing.isNull() && !rest.isRoot() && parseIndex(rest.head()) >= 0) {
            existing = JsonValue.array(List.of());
        }
        var updated = rest.set(existing, value);
        if (updated == existing && !rest.isRoot()) {
            return root;
        }
        fields.put(segment, updated);
        return JsonValue.object(fields);
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }

    static int parseIndex(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}

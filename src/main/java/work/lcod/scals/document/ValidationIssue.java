package work.lcod.scals.document;

/**
 * One problem found in a wire document. {@code path} uses JSONPath-like notation rooted at {@code $}.
 */
public record ValidationIssue(String path, Kind kind, String message) {
    public enum Kind {
        MISSING_FIELD,
        TYPE_MISMATCH,
        INVALID_ENUM,
        MUTUALLY_EXCLUSIVE,
        OUT_OF_RANGE,
        UNKNOWN_COMPONENT,
        UNKNOWN_ACTION,
        INVALID_FORMAT,
        UNSUPPORTED_VERSION
    }

    @Override
    public String toString() {
        return path + ": " + message + " (" + kind + ")";
    }
}

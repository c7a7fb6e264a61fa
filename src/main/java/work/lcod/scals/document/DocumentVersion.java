package work.lcod.scals.document;

import java.util.regex.Pattern;

/**
 * Semantic version carried by a document. Minor and patch releases only add optional fields, so
 * compatibility is decided by the major number.
 */
public record DocumentVersion(int major, int minor, int patch) implements Comparable<DocumentVersion> {
    public static final DocumentVersion CURRENT = new DocumentVersion(1, 0, 0);

    private static final Pattern FORMAT = Pattern.compile("(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?");

    /**
     * Parses {@code "1"}, {@code "1.2"} or {@code "1.2.3"}.
     *
     * @throws IllegalArgumentException when the text is not a version
     */
    public static DocumentVersion parse(String text) {
        var matcher = FORMAT.matcher(text == null ? "" : text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid document version: " + text);
        }
        return new DocumentVersion(
            Integer.parseInt(matcher.group(1)),
            matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2)),
            matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3))
        );
    }

    public boolean isSupported() {
        return major == CURRENT.major;
    }

    @Override
    public int compareTo(DocumentVersion other) {
        if (major != other.major) return Integer.compare(major, other.major);
        if (minor != other.minor) return Integer.compare(minor, other.minor);
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}

package work.lcod.scals.resolution;

/**
 * No resolver is registered for a node kind.
 */
public final class UnknownKindException extends ResolutionException {
    private final String kind;

    public UnknownKindException(String category, String kind) {
        super("unknown_kind", "No " + category + " resolver registered for kind '" + kind + "'");
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }
}

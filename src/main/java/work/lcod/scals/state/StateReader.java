package work.lcod.scals.state;

/**
 * Read access to path-addressed values. Unknown paths read as {@link JsonValue#NULL}.
 */
@FunctionalInterface
public interface StateReader {
    JsonValue read(String path);
}

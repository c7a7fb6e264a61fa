package work.lcod.scals.document;

/**
 * A node of the document tree. {@link #kind()} is the wire {@code type} used to pick a resolver.
 */
public interface LayoutNode {
    String kind();
}

package work.lcod.scals.ir;

/**
 * A subtree that could not be resolved and was left out of the tree.
 *
 * @param documentPath where the failing node sits, e.g. {@code root.children[1].children[0]}
 * @param code machine-readable category such as {@code unknown_kind} or {@code style_cycle}
 */
public record ResolutionError(String documentPath, String code, String message) {}

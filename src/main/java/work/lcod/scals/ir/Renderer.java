package work.lcod.scals.ir;

/**
 * Turns a render tree into platform output.
 *
 * @param <O> what the renderer produces
 */
public interface Renderer<O> {
    O render(RenderTree tree);

    /**
     * Output for an incremental update. {@code tree} already contains the splices. Renderers that
     * cannot patch in place re-render the whole tree.
     */
    default O renderUpdate(RenderTree tree, RenderUpdate update) {
        return render(tree);
    }
}

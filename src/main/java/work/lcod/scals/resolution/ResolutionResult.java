package work.lcod.scals.resolution;

import java.util.List;
import java.util.Optional;
import work.lcod.scals.ir.RenderTree;
import work.lcod.scals.ir.ResolutionError;

/**
 * Output of a full resolution pass: the render tree and, when tracking is enabled, the view tree
 * that drives incremental updates.
 */
public final class ResolutionResult {
    private final RenderTree tree;
    private final ViewNode viewRoot;
    private final ResolutionEnvironment environment;

    ResolutionResult(RenderTree tree, ViewNode viewRoot, ResolutionEnvironment environment) {
        this.tree = tree;
        this.viewRoot = viewRoot;
        this.environment = environment;
    }

    public RenderTree tree() {
        return tree;
    }

    public Optional<ViewNode> viewRoot() {
        return Optional.ofNullable(viewRoot);
    }

    public List<ResolutionError> errors() {
        return tree.errors();
    }

    public boolean isTracked() {
        return viewRoot != null;
    }

    ResolutionEnvironment environment() {
        return environment;
    }
}

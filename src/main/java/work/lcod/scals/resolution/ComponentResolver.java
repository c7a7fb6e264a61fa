package work.lcod.scals.resolution;

import work.lcod.scals.document.Component;
import work.lcod.scals.ir.RenderNode;

/**
 * Resolves one component kind. Implementations may throw {@link ResolutionException}; the
 * orchestrator then drops the component and reports the error.
 */
@FunctionalInterface
public interface ComponentResolver {
    RenderNode resolve(Component component, ResolutionContext context);
}

package work.lcod.scals.resolution;

import work.lcod.scals.document.LayoutNode;
import work.lcod.scals.ir.RenderNode;

/**
 * Resolves one kind of structural node (stack, repeater, spacer, section layout).
 */
@FunctionalInterface
public interface LayoutResolver {
    RenderNode resolve(LayoutNode node, ResolutionContext context);
}

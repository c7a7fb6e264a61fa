package work.lcod.scals.resolution;

import work.lcod.scals.ir.RenderTree;
import work.lcod.scals.ir.RenderUpdate;

/**
 * Receives the new tree and the splices that produced it after each incremental pass. An empty
 * update means the whole tree was resolved again.
 */
@FunctionalInterface
public interface RenderListener {
    void onUpdate(RenderTree tree, RenderUpdate update);
}

package work.lcod.scals.style;

import java.util.List;
import work.lcod.scals.resolution.ResolutionException;

public final class StyleCycleException extends ResolutionException {
    private final List<String> chain;

    public StyleCycleException(List<String> chain) {
        super("style_cycle", "Cyclic style inheritance: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}

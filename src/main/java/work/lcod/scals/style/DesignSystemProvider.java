package work.lcod.scals.style;

import java.util.Optional;
import work.lcod.scals.document.Style;

/**
 * Supplies style tokens for {@code @}-prefixed style ids, e.g. {@code @button.primary}.
 */
@FunctionalInterface
public interface DesignSystemProvider {
    /**
     * @param reference the style id without its {@code @} prefix
     */
    Optional<Style> resolveStyle(String reference);
}

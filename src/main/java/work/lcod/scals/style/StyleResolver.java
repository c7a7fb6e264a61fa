package work.lcod.scals.style;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scals.document.Style;

/**
 * Folds single-parent style chains into a {@link ResolvedStyle}.
 *
 * <p>Ids prefixed with {@code @} are looked up through the {@link DesignSystemProvider}; other ids
 * come from the document's own styles. The fold runs from the chain's root to the requested style,
 * and an inline style is merged last.
 */
public final class StyleResolver {
    private static final Logger log = LoggerFactory.getLogger(StyleResolver.class);

    private final Map<String, Style> styles;
    private final DesignSystemProvider designSystem;

    public StyleResolver(Map<String, Style> styles) {
        this(styles, null);
    }

    public StyleResolver(Map<String, Style> styles, DesignSystemProvider designSystem) {
        this.styles = styles == null ? Map.of() : Map.copyOf(styles);
        this.designSystem = designSystem;
    }

    public ResolvedStyle resolve(String styleId) {
        var resolved = ResolvedStyle.empty();
        if (styleId == null) {
            return resolved;
        }
        for (var style : chain(styleId)) {
            resolved.merge(style);
        }
        return resolved;
    }

    public ResolvedStyle resolve(String styleId, Style inline) {
        var resolved = resolve(styleId);
        if (inline != null) {
            if (inline.inherits() != null && styleId == null) {
                resolved = resolve(inline.inherits());
            }
            resolved.merge(inline);
        }
        return resolved;
    }

    /**
     * Styles from the chain's root down to {@code styleId}.
     *
     * @throws StyleCycleException when a style reaches itself through {@code inherits}
     */
    Deque<Style> chain(String styleId) {
        var chain = new ArrayDeque<Style>();
        var visited = new LinkedHashSet<String>();
        var current = styleId;
        while (current != null) {
            if (!visited.add(current)) {
                var cycle = new ArrayList<>(visited);
                cycle.add(current);
                throw new StyleCycleException(cycle);
            }
            var style = lookup(current);
            if (style == null) {
                break;
            }
            chain.addFirst(style);
            current = style.inherits();
        }
        return chain;
    }

    private Style lookup(String styleId) {
        if (styleId.startsWith("@")) {
            if (designSystem == null) {
                log.warn("Design system style '{}' requested but no provider is registered", styleId);
                return null;
            }
            var style = designSystem.resolveStyle(styleId.substring(1)).orElse(null);
            if (style == null) {
                log.warn("Design system has no style '{}'", styleId);
            }
            return style;
        }
        var style = styles.get(styleId);
        if (style == null) {
            log.warn("Unknown style '{}'", styleId);
        }
        return style;
    }
}

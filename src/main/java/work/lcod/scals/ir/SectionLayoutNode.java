package work.lcod.scals.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Scrollable collection of sections. For child-index addressing the node's children are each
 * section's header, items and footer, flattened in order.
 */
public record SectionLayoutNode(String id, double sectionSpacing, List<Section> sections) implements RenderNode {
    public static final String KIND = "sectionLayout";

    public SectionLayoutNode {
        sections = List.copyOf(sections);
    }

    public enum SectionType { HORIZONTAL, LIST, GRID, FLOW }

    public enum SnapBehavior {
        NONE, VIEW_ALIGNED, PAGING;

        public static SnapBehavior from(String value) {
            if ("viewAligned".equals(value)) return VIEW_ALIGNED;
            if ("paging".equals(value)) return PAGING;
            return NONE;
        }
    }

    /** Grid columns: {@code count} fixed columns, or as many as fit at {@code minWidth}. */
    public record ColumnConfig(boolean adaptive, int count, double minWidth) {
        public static ColumnConfig fixed(int count) {
            return new ColumnConfig(false, count, 0);
        }

        public static ColumnConfig adaptive(double minWidth) {
            return new ColumnConfig(true, 0, minWidth);
        }
    }

    public record ItemDimensions(Dimension width, Dimension height, Double aspectRatio) {}

    public record SectionConfig(
        Alignment.Horizontal alignment,
        double itemSpacing,
        double lineSpacing,
        EdgeInsets contentInsets,
        ItemDimensions itemDimensions,
        boolean showsIndicators,
        boolean pagingEnabled,
        SnapBehavior snapBehavior,
        boolean showsDividers
    ) {}

    /**
     * @param columns only set for {@link SectionType#GRID}
     */
    public record Section(
        String id,
        SectionType type,
        ColumnConfig columns,
        RenderNode header,
        RenderNode footer,
        boolean stickyHeader,
        SectionConfig config,
        List<RenderNode> items
    ) {
        public Section {
            items = List.copyOf(items);
        }
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public List<RenderNode> children() {
        var flat = new ArrayList<RenderNode>();
        for (var section : sections) {
            if (section.header() != null) flat.add(section.header());
            flat.addAll(section.items());
            if (section.footer() != null) flat.add(section.footer());
        }
        return flat;
    }

    /**
     * Copy with the flattened child at {@code index} replaced.
     */
    public SectionLayoutNode withChild(int index, RenderNode replacement) {
        var remaining = index;
        var updated = new ArrayList<Section>(sections.size());
        for (var section : sections) {
            var header = section.header();
            var footer = section.footer();
            var items = new ArrayList<>(section.items());
            if (remaining >= 0 && header != null) {
                if (remaining == 0) header = replacement;
                remaining--;
            }
            if (remaining >= 0 && remaining < items.size()) {
                items.set(remaining, replacement);
                remaining = -1;
            } else if (remaining >= 0) {
                remaining -= items.size();
                if (footer != null) {
                    if (remaining == 0) footer = replacement;
                    remaining--;
                }
            }
            updated.add(new Section(section.id(), section.type(), section.columns(), header, footer,
                section.stickyHeader(), section.config(), items));
        }
        if (remaining >= 0) {
            throw new IndexOutOfBoundsException("No child " + index + " in section layout " + id);
        }
        return new SectionLayoutNode(id, sectionSpacing, updated);
    }
}

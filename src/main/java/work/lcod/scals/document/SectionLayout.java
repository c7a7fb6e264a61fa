package work.lcod.scals.document;

import java.util.List;
import work.lcod.scals.ir.Dimension;

/**
 * Collection of sections, each arranged by a pluggable layout (list, horizontal, grid, flow...).
 */
public record SectionLayout(String id, Double sectionSpacing, List<Section> sections) implements LayoutNode {
    public static final String KIND = "sectionLayout";

    public SectionLayout {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    @Override
    public String kind() {
        return KIND;
    }

    /**
     * One section. Children are either static or produced from {@code dataSource} with
     * {@code itemTemplate}.
     */
    public record Section(
        String id,
        Config layout,
        LayoutNode header,
        LayoutNode footer,
        boolean stickyHeader,
        List<LayoutNode> children,
        String dataSource,
        LayoutNode itemTemplate,
        String itemVariable,
        String indexVariable
    ) {
        public Section {
            children = children == null ? List.of() : List.copyOf(children);
            itemVariable = itemVariable == null ? "item" : itemVariable;
            indexVariable = indexVariable == null ? "index" : indexVariable;
        }
    }

    public record Config(
        String type,
        String alignment,
        Double itemSpacing,
        Double lineSpacing,
        Padding contentInsets,
        ItemDimensions itemDimensions,
        Boolean showsIndicators,
        Boolean pagingEnabled,
        String snapBehavior,
        Columns columns,
        Boolean showsDividers
    ) {}

    /** Grid columns: a fixed count or an adaptive minimum width. */
    public record Columns(Integer fixed, Double adaptiveMinWidth) {}

    public record ItemDimensions(Dimension width, Dimension height, Double aspectRatio) {}
}

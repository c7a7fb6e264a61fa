package work.lcod.scals.sections;

import work.lcod.scals.document.SectionLayout;
import work.lcod.scals.ir.Alignment;
import work.lcod.scals.ir.EdgeInsets;
import work.lcod.scals.ir.SectionLayoutNode.ColumnConfig;
import work.lcod.scals.ir.SectionLayoutNode.ItemDimensions;
import work.lcod.scals.ir.SectionLayoutNode.SectionConfig;
import work.lcod.scals.ir.SectionLayoutNode.SectionType;
import work.lcod.scals.ir.SectionLayoutNode.SnapBehavior;
import work.lcod.scals.resolution.ResolutionContext;
import work.lcod.scals.resolution.ResolvedSectionLayout;
import work.lcod.scals.resolution.SectionLayoutConfigResolverRegistry;

/**
 * Arrangements for {@code list}, {@code horizontal}, {@code grid} and {@code flow} sections.
 * Only lists show dividers unless the document says otherwise.
 */
public final class BuiltinSectionLayoutConfigResolvers {
    static final double HORIZONTAL_ITEM_SPACING = 12;
    static final double DEFAULT_LINE_SPACING = 8;
    static final int DEFAULT_GRID_COLUMNS = 2;

    private BuiltinSectionLayoutConfigResolvers() {}

    public static void register(SectionLayoutConfigResolverRegistry registry) {
        registry.register("list", BuiltinSectionLayoutConfigResolvers::list);
        registry.register("horizontal", BuiltinSectionLayoutConfigResolvers::horizontal);
        registry.register("grid", BuiltinSectionLayoutConfigResolvers::grid);
        registry.register("flow", BuiltinSectionLayoutConfigResolvers::flow);
    }

    static ResolvedSectionLayout list(SectionLayout.Config config, ResolutionContext context) {
        return new ResolvedSectionLayout(SectionType.LIST, null,
            sectionConfig(config, context.defaultSectionItemSpacing(), true));
    }

    static ResolvedSectionLayout horizontal(SectionLayout.Config config, ResolutionContext context) {
        return new ResolvedSectionLayout(SectionType.HORIZONTAL, null,
            sectionConfig(config, HORIZONTAL_ITEM_SPACING, false));
    }

    static ResolvedSectionLayout grid(SectionLayout.Config config, ResolutionContext context) {
        return new ResolvedSectionLayout(SectionType.GRID, columns(config.columns()),
            sectionConfig(config, context.defaultSectionItemSpacing(), false));
    }

    static ResolvedSectionLayout flow(SectionLayout.Config config, ResolutionContext context) {
        return new ResolvedSectionLayout(SectionType.FLOW, null,
            sectionConfig(config, context.defaultSectionItemSpacing(), false));
    }

    static ColumnConfig columns(SectionLayout.Columns columns) {
        if (columns == null) {
            return ColumnConfig.fixed(DEFAULT_GRID_COLUMNS);
        }
        if (columns.adaptiveMinWidth() != null) {
            return ColumnConfig.adaptive(columns.adaptiveMinWidth());
        }
        return ColumnConfig.fixed(columns.fixed() == null ? DEFAULT_GRID_COLUMNS : columns.fixed());
    }

    private static SectionConfig sectionConfig(SectionLayout.Config config, double defaultItemSpacing, boolean dividersByDefault) {
        return new SectionConfig(
            alignment(config.alignment()),
            config.itemSpacing() == null ? defaultItemSpacing : config.itemSpacing(),
            config.lineSpacing() == null ? DEFAULT_LINE_SPACING : config.lineSpacing(),
            config.contentInsets() == null ? EdgeInsets.ZERO : config.contentInsets().toEdgeInsets(),
            itemDimensions(config.itemDimensions()),
            Boolean.TRUE.equals(config.showsIndicators()),
            Boolean.TRUE.equals(config.pagingEnabled()),
            SnapBehavior.from(config.snapBehavior()),
            config.showsDividers() == null ? dividersByDefault : config.showsDividers()
        );
    }

    // Sections align leading unless told otherwise.
    private static Alignment.Horizontal alignment(String value) {
        if ("center".equals(value)) return Alignment.Horizontal.CENTER;
        if ("trailing".equals(value)) return Alignment.Horizontal.TRAILING;
        return Alignment.Horizontal.LEADING;
    }

    private static ItemDimensions itemDimensions(SectionLayout.ItemDimensions dimensions) {
        if (dimensions == null) {
            return null;
        }
        return new ItemDimensions(dimensions.width(), dimensions.height(), dimensions.aspectRatio());
    }
}

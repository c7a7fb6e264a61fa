package work.lcod.scals.resolution;

import work.lcod.scals.ir.SectionLayoutNode;

/**
 * Arrangement of one section.
 *
 * @param columns grid columns; {@code null} for other section types
 */
public record ResolvedSectionLayout(
    SectionLayoutNode.SectionType type,
    SectionLayoutNode.ColumnConfig columns,
    SectionLayoutNode.SectionConfig config
) {}

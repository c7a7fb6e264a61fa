package work.lcod.scals.document;

import work.lcod.scals.ir.Alignment;

/**
 * Data-driven repeater: resolves {@code template} once per element of the array at {@code items}.
 */
public record ForEach(
    String items,
    String itemVariable,
    String indexVariable,
    String layout,
    Double spacing,
    Alignment alignment,
    Padding padding,
    LayoutNode template,
    LayoutNode emptyView
) implements LayoutNode {
    public static final String KIND = "forEach";

    public ForEach {
        itemVariable = itemVariable == null ? "item" : itemVariable;
        indexVariable = indexVariable == null ? "index" : indexVariable;
        layout = layout == null ? Layout.VSTACK : layout;
    }

    @Override
    public String kind() {
        return KIND;
    }
}

package work.lcod.scals.document;

import java.util.List;
import work.lcod.scals.ir.SafeAreaInsets;

public record RootComponent(
    String backgroundColor,
    SafeAreaInsets edgeInsets,
    String styleId,
    String colorScheme,
    ActionBinding onAppear,
    ActionBinding onDisappear,
    List<LayoutNode> children
) {
    public RootComponent {
        children = children == null ? List.of() : List.copyOf(children);
    }
}

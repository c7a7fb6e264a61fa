package work.lcod.scals.resolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import work.lcod.scals.document.LayoutNode;
import work.lcod.scals.document.SectionLayout;
import work.lcod.scals.ir.RenderNode;
import work.lcod.scals.ir.SectionLayoutNode;
import work.lcod.scals.state.JsonValue;

/**
 * Resolves section layouts. Each section's arrangement comes from the section layout config
 * registry; its items are static children or one template instance per data source element.
 *
 * <p>Header, items and footer are resolved in that order so the view tree matches the flattened
 * child order of {@link SectionLayoutNode}.
 */
final class SectionLayoutResolver {
    static final SectionLayout.Config EMPTY_CONFIG =
        new SectionLayout.Config(null, null, null, null, null, null, null, null, null, null, null);

    private SectionLayoutResolver() {}

    static RenderNode resolve(LayoutNode node, ResolutionContext context) {
        var layout = BuiltinLayoutResolvers.expect(node, SectionLayout.class);
        var sections = new ArrayList<SectionLayoutNode.Section>(layout.sections().size());
        for (int i = 0; i < layout.sections().size(); i++) {
            sections.add(resolveSection(layout.sections().get(i), i, context));
        }
        return new SectionLayoutNode(
            context.nodeId(layout.id()),
            layout.sectionSpacing() == null ? 0 : layout.sectionSpacing(),
            sections
        );
    }

    private static SectionLayoutNode.Section resolveSection(SectionLayout.Section section, int index, ResolutionContext context) {
        var config = section.layout() == null ? EMPTY_CONFIG : section.layout();
        var type = config.type() == null ? "list" : config.type();
        var arrangement = context.registries().sectionLayouts().resolver(type)
            .orElseThrow(() -> new UnknownKindException("section layout", type))
            .resolve(config, context);

        var idBase = "s" + index;
        var pathBase = ".sections[" + index + "]";
        var header = section.header() == null
            ? null
            : context.resolveChild(section.header(), idBase + ".header", pathBase + ".header");
        var items = section.dataSource() != null && section.itemTemplate() != null
            ? resolveDataDriven(section, idBase, pathBase, context)
            : resolveStatic(section.children(), idBase, pathBase, context);
        var footer = section.footer() == null
            ? null
            : context.resolveChild(section.footer(), idBase + ".footer", pathBase + ".footer");

        return new SectionLayoutNode.Section(
            section.id() != null ? section.id() : context.structuralId() + "." + idBase,
            arrangement.type(),
            arrangement.columns(),
            header,
            footer,
            section.stickyHeader(),
            arrangement.config(),
            items
        );
    }

    private static List<RenderNode> resolveStatic(List<LayoutNode> children, String idBase, String pathBase, ResolutionContext context) {
        var items = new ArrayList<RenderNode>(children.size());
        for (int i = 0; i < children.size(); i++) {
            var child = context.resolveChild(children.get(i), idBase + "." + i, pathBase + ".children[" + i + "]");
            if (child != null) {
                items.add(child);
            }
        }
        return items;
    }

    private static List<RenderNode> resolveDataDriven(SectionLayout.Section section, String idBase, String pathBase, ResolutionContext context) {
        var elements = context.read(section.dataSource()).asArray().orElse(List.of());
        var items = new ArrayList<RenderNode>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            var bindings = new LinkedHashMap<String, JsonValue>();
            bindings.put(section.indexVariable(), JsonValue.of((long) i));
            bindings.put(section.itemVariable(), elements.get(i));
            var child = context.resolveChild(section.itemTemplate(), idBase + "." + i, pathBase + ".itemTemplate", bindings);
            if (child != null) {
                items.add(child);
            }
        }
        return items;
    }
}

package work.lcod.scals.sections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.scals.ir.Alignment;
import work.lcod.scals.ir.EdgeInsets;
import work.lcod.scals.ir.RenderTree;
import work.lcod.scals.ir.SectionLayoutNode;
import work.lcod.scals.ir.TextNode;
import work.lcod.scals.resolution.ResolutionResult;
import work.lcod.scals.resolution.Resolver;
import work.lcod.scals.resolution.ViewTreeUpdater;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.state.StateStore;
import work.lcod.scals.support.ScalsTestSupport;

class BuiltinSectionLayoutConfigResolversTest {
    private static final String CATALOG = "{\"id\":\"catalog\",\"state\":{\"products\":[{\"name\":\"Tea\"},{\"name\":\"Coffee\"}],\"count\":2},"
        + "\"root\":{\"children\":[{\"type\":\"sectionLayout\",\"id\":\"catalog\",\"sectionSpacing\":24,\"sections\":["
        + "{\"id\":\"featured\",\"layout\":{\"type\":\"horizontal\",\"isPagingEnabled\":true,\"snapBehavior\":\"paging\"},"
        + "\"children\":[{\"type\":\"label\",\"text\":\"Banner\"}]},"
        + "{\"id\":\"all\",\"layout\":{\"type\":\"list\"},\"stickyHeader\":true,"
        + "\"header\":{\"type\":\"label\",\"text\":\"All products\"},"
        + "\"dataSource\":\"products\",\"itemVariable\":\"product\","
        + "\"itemTemplate\":{\"type\":\"label\",\"text\":\"${index}: ${product.name}\"},"
        + "\"footer\":{\"type\":\"label\",\"id\":\"total\",\"text\":\"${count} products\"}},"
        + "{\"layout\":{\"type\":\"grid\",\"columns\":{\"adaptive\":{\"minWidth\":120}},\"itemSpacing\":6,"
        + "\"alignment\":\"center\",\"contentInsets\":{\"horizontal\":16}},\"children\":[]},"
        + "{\"layout\":{\"type\":\"grid\"},\"children\":[]},"
        + "{\"layout\":{\"type\":\"flow\",\"showsDividers\":true},\"children\":[]}]}]}}";

    private static ResolutionResult resolve(StateStore store) {
        var document = ScalsTestSupport.document(CATALOG);
        store.initialize(document.state());
        return new Resolver().resolve(document, store);
    }

    private static SectionLayoutNode catalog(RenderTree tree) {
        return ScalsTestSupport.require(tree, "catalog", SectionLayoutNode.class);
    }

    @Test
    void sectionsGetTheirArrangement() {
        var layout = catalog(resolve(new StateStore()).tree());
        assertEquals(24, layout.sectionSpacing());
        assertEquals(5, layout.sections().size());

        var featured = layout.sections().get(0);
        assertEquals("featured", featured.id());
        assertEquals(SectionLayoutNode.SectionType.HORIZONTAL, featured.type());
        assertNull(featured.columns());
        assertEquals(12, featured.config().itemSpacing());
        assertTrue(featured.config().pagingEnabled());
        assertEquals(SectionLayoutNode.SnapBehavior.PAGING, featured.config().snapBehavior());
        assertFalse(featured.config().showsDividers());

        var list = layout.sections().get(1);
        assertEquals(SectionLayoutNode.SectionType.LIST, list.type());
        assertTrue(list.stickyHeader());
        assertTrue(list.config().showsDividers());
        assertEquals(8, list.config().itemSpacing());
        assertEquals(Alignment.Horizontal.LEADING, list.config().alignment());

        var adaptive = layout.sections().get(2);
        assertEquals(SectionLayoutNode.ColumnConfig.adaptive(120), adaptive.columns());
        assertEquals(6, adaptive.config().itemSpacing());
        assertEquals(Alignment.Horizontal.CENTER, adaptive.config().alignment());
        assertEquals(new EdgeInsets(0, 0, 16, 16), adaptive.config().contentInsets());
        assertEquals("root.0.s2", adaptive.id());

        assertEquals(SectionLayoutNode.ColumnConfig.fixed(2), layout.sections().get(3).columns());
        assertTrue(layout.sections().get(4).config().showsDividers());
        assertEquals(SectionLayoutNode.SectionType.FLOW, layout.sections().get(4).type());
    }

    @Test
    void dataDrivenItemsBindTheirElement() {
        var list = catalog(resolve(new StateStore()).tree()).sections().get(1);

        assertEquals("All products", ((TextNode) list.header()).content());
        assertEquals(
            List.of("0: Tea", "1: Coffee"),
            list.items().stream().map(item -> ((TextNode) item).content()).toList()
        );
        assertEquals("2 products", ((TextNode) list.footer()).content());
    }

    @Test
    void childrenFlattenHeaderItemsAndFooter() {
        var layout = catalog(resolve(new StateStore()).tree());
        var children = layout.children();
        assertEquals(5, children.size());
        assertEquals("Banner", ((TextNode) children.get(0)).content());
        assertEquals("total", children.get(4).id());

        var replaced = layout.withChild(3, children.get(0));
        assertSame(children.get(0), replaced.sections().get(1).items().get(1));
        assertEquals(layout.sections().get(1).footer(), replaced.sections().get(1).footer());
    }

    @Test
    void footerChangeSplicesAtItsFlattenedIndex() {
        var store = new StateStore();
        var pending = new ArrayList<Runnable>();
        var updater = new ViewTreeUpdater(resolve(store), pending::add);

        store.set("count", JsonValue.of(3L));
        var update = updater.flush();

        assertEquals(1, update.splices().size());
        assertEquals(List.of(0, 4), update.splices().get(0).childPath());
        var footer = catalog(updater.tree()).sections().get(1).footer();
        assertEquals("3 products", ((TextNode) footer).content());
    }

    @Test
    void dataSourceChangeRebuildsTheLayout() {
        var store = new StateStore();
        var pending = new ArrayList<Runnable>();
        var updater = new ViewTreeUpdater(resolve(store), pending::add);
        var updates = new ArrayList<List<Integer>>();
        updater.addListener((tree, update) -> update.splices().forEach(splice -> updates.add(splice.childPath())));

        store.append("products", JsonValue.object(Map.of("name", JsonValue.of("Cocoa"))));
        pending.forEach(Runnable::run);

        assertEquals(List.of(List.of(0)), updates);
        var items = catalog(updater.tree()).sections().get(1).items();
        assertEquals("2: Cocoa", ((TextNode) items.get(2)).content());
    }
}

package work.lcod.scals.resolution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.scals.action.ActionResolver;
import work.lcod.scals.document.DocumentDefinition;
import work.lcod.scals.ir.ContainerNode;
import work.lcod.scals.ir.RenderTree;
import work.lcod.scals.ir.RenderUpdate;
import work.lcod.scals.ir.TextNode;
import work.lcod.scals.ir.ToggleNode;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.state.StateStore;
import work.lcod.scals.support.ScalsTestSupport;

class ViewTreeUpdaterTest {
    private final List<Runnable> pending = new ArrayList<>();
    private final Resolver resolver = new Resolver();

    private ViewTreeUpdater open(DocumentDefinition document, StateStore store) {
        store.initialize(document.state());
        return new ViewTreeUpdater(resolver.resolve(document, store), pending::add);
    }

    private void runPending() {
        var tasks = new ArrayList<>(pending);
        pending.clear();
        tasks.forEach(Runnable::run);
    }

    @Test
    void reResolvesOnlyNodesReadingTheChangedPath() {
        var store = new StateStore();
        var updater = open(ScalsTestSupport.loadFixture("counter.json"), store);
        var before = updater.tree();

        store.set("count", 1);
        var update = updater.flush();

        assertEquals(1, update.splices().size());
        assertEquals(List.of(0, 1), update.splices().get(0).childPath());
        assertEquals("1", ScalsTestSupport.require(updater.tree(), "countLabel", TextNode.class).content());
        assertEquals(2, resolver.resolutionCount("countLabel"));
        assertEquals(1, resolver.resolutionCount("title"));
        assertEquals(1, resolver.resolutionCount("root.0"));
        assertSame(before.nodeAt(List.of(0, 0)), updater.tree().nodeAt(List.of(0, 0)));
        assertSame(before.nodeAt(List.of(0, 2)), updater.tree().nodeAt(List.of(0, 2)));
    }

    @Test
    void writesAreCoalescedIntoOnePass() {
        var store = new StateStore();
        var updater = open(ScalsTestSupport.loadFixture("counter.json"), store);

        store.set("count", 1);
        store.set("count", 2);
        store.set("count", 3);
        assertEquals(1, pending.size());
        runPending();

        assertEquals("3", ScalsTestSupport.require(updater.tree(), "countLabel", TextNode.class).content());
        assertEquals(2, resolver.resolutionCount("countLabel"));
    }

    @Test
    void unrelatedWriteLeavesTreeUntouched() {
        var store = new StateStore();
        var updater = open(ScalsTestSupport.loadFixture("counter.json"), store);
        var before = updater.tree();

        store.set("somethingElse", true);
        var update = updater.flush();

        assertTrue(update.isEmpty());
        assertSame(before, updater.tree());
    }

    @Test
    void siblingFieldsOfOneObjectAreIndependent() {
        var document = ScalsTestSupport.document("{\"id\":\"d\",\"state\":{\"user\":{\"name\":\"Ada\",\"email\":\"ada@example.com\"}},"
            + "\"root\":{\"children\":[{\"type\":\"label\",\"id\":\"name\",\"text\":\"${user.name}\"},"
            + "{\"type\":\"label\",\"id\":\"email\",\"text\":\"${user.email}\"}]}}");
        var store = new StateStore();
        var updater = open(document, store);

        store.set("user.name", "Grace");
        updater.flush();
        assertEquals("Grace", ScalsTestSupport.require(updater.tree(), "name", TextNode.class).content());
        assertEquals(2, resolver.resolutionCount("name"));
        assertEquals(1, resolver.resolutionCount("email"));

        store.set("user", Map.of("name", "Linus", "email", "linus@example.com"));
        updater.flush();
        assertEquals("linus@example.com", ScalsTestSupport.require(updater.tree(), "email", TextNode.class).content());
        assertEquals(3, resolver.resolutionCount("name"));
        assertEquals(2, resolver.resolutionCount("email"));
    }

    @Test
    void appendingReResolvesTheRepeaterOnce() {
        var store = new StateStore();
        var updater = open(ScalsTestSupport.loadFixture("todo.yaml"), store);

        store.append("todos", JsonValue.from(Map.of("title", "Third", "done", false)));
        var update = updater.flush();

        assertEquals(1, update.splices().size());
        assertEquals(List.of(1), update.splices().get(0).childPath());
        var repeater = ScalsTestSupport.require(updater.tree(), "root.1", ContainerNode.class);
        assertEquals(3, repeater.children().size());
        assertEquals("2. Third", ScalsTestSupport.require(updater.tree(), "root.1.2.0", TextNode.class).content());
        assertEquals(1, resolver.resolutionCount("header"));
    }

    @Test
    void replacedSubtreesKeepTracking() {
        var store = new StateStore();
        var updater = open(ScalsTestSupport.loadFixture("todo.yaml"), store);

        store.append("todos", JsonValue.from(Map.of("title", "Third", "done", false)));
        updater.flush();
        store.set("todos[0].done", true);
        updater.flush();
        assertTrue(ScalsTestSupport.require(updater.tree(), "root.1.0.1", ToggleNode.class).isOn());

        store.clearArray("todos");
        updater.flush();
        assertEquals("Nothing to do", ScalsTestSupport.require(updater.tree(), "emptyLabel", TextNode.class).content());

        store.set("filter", "done");
        var update = updater.flush();
        assertEquals(List.of(0), update.splices().get(0).childPath());
        assertEquals("Filter: done", ScalsTestSupport.require(updater.tree(), "header", TextNode.class).content());
    }

    @Test
    void listenersReceiveTreeAndSplices() {
        var store = new StateStore();
        var updater = open(ScalsTestSupport.loadFixture("counter.json"), store);
        var trees = new ArrayList<RenderTree>();
        var updates = new ArrayList<RenderUpdate>();
        updater.addListener((tree, update) -> {
            trees.add(tree);
            updates.add(update);
        });

        store.set("count", 5);
        runPending();
        store.set("ignored", 1);
        runPending();

        assertEquals(1, updates.size());
        assertSame(updater.tree(), trees.get(0));
        var node = (TextNode) updates.get(0).splices().get(0).node();
        assertEquals("5", node.content());
    }

    @Test
    void closedUpdaterIgnoresWrites() {
        var store = new StateStore();
        var updater = open(ScalsTestSupport.loadFixture("counter.json"), store);
        var before = updater.tree();
        updater.close();

        store.set("count", 9);
        assertTrue(pending.isEmpty());
        assertSame(before, updater.tree());
    }

    @Test
    void requiresTrackedResult() {
        var document = ScalsTestSupport.loadFixture("counter.json");
        var store = new StateStore();
        store.initialize(document.state());
        var untracked = new Resolver(ResolverRegistries.defaults(), ActionResolver.defaults(), null, false, 8);
        var result = untracked.resolve(document, store);
        assertThrows(IllegalArgumentException.class, () -> new ViewTreeUpdater(result, Runnable::run));
    }
}

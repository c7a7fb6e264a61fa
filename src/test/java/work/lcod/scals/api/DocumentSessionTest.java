package work.lcod.scals.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import work.lcod.scals.ir.ButtonNode;
import work.lcod.scals.ir.DebugRenderer;
import work.lcod.scals.ir.RenderUpdate;
import work.lcod.scals.ir.TextNode;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.state.StateStore;
import work.lcod.scals.support.ScalsTestSupport;

class DocumentSessionTest {
    private static String countText(DocumentSession session) {
        return ScalsTestSupport.require(session.tree(), "countLabel", TextNode.class).content();
    }

    @Test
    void actionsDriveIncrementalUpdates() {
        var engine = ScalsEngine.create();
        try (var session = engine.open(ScalsTestSupport.loadFixture("counter.json"))) {
            assertTrue(session.isTracked());
            assertEquals("0", countText(session));

            session.execute("increment").join();
            session.execute("increment").join();
            session.execute("increment").join();

            assertEquals("3", countText(session));
            assertEquals(JsonValue.of(3L), session.store().get("count"));
            assertEquals(4, engine.resolver().resolutionCount("countLabel"));
            assertEquals(1, engine.resolver().resolutionCount("title"));
        }
    }

    @Test
    void listenersReceiveSplices() {
        try (var session = ScalsEngine.create().open(ScalsTestSupport.loadFixture("counter.json"))) {
            var updates = new ArrayList<RenderUpdate>();
            session.addRenderListener((tree, update) -> updates.add(update));

            session.execute("increment").join();

            assertEquals(1, updates.size());
            assertEquals(List.of(0, 1), updates.get(0).splices().get(0).childPath());
        }
    }

    @Test
    void untrackedSessionsResolveEverythingAgain() {
        var engine = ScalsEngine.builder()
            .configuration(EngineConfiguration.builder().trackingEnabled(false).build())
            .build();
        try (var session = engine.open(ScalsTestSupport.loadFixture("counter.json"))) {
            assertFalse(session.isTracked());
            var updates = new ArrayList<RenderUpdate>();
            session.addRenderListener((tree, update) -> updates.add(update));

            session.execute("increment").join();

            assertEquals("1", countText(session));
            assertEquals(1, updates.size());
            assertTrue(updates.get(0).isEmpty());
            assertEquals(2, engine.resolver().resolutionCount("title"));
        }
    }

    @Test
    void passesRunOnTheConfiguredExecutor() {
        var pending = new ArrayList<Runnable>();
        var engine = ScalsEngine.builder()
            .configuration(EngineConfiguration.builder().resolutionExecutor(pending::add).build())
            .build();
        try (var session = engine.open(ScalsTestSupport.loadFixture("counter.json"))) {
            session.execute("increment").join();
            session.execute("increment").join();
            assertEquals("0", countText(session));
            assertEquals(1, pending.size());

            pending.remove(0).run();
            assertEquals("2", countText(session));
        }
    }

    @Test
    void existingStoreIsKept() {
        var document = ScalsTestSupport.loadFixture("counter.json");
        var store = new StateStore();
        store.set("count", 7);
        store.set("title", "Restored");
        try (var session = ScalsEngine.create().open(document, store)) {
            assertSame(store, session.store());
            assertEquals("7", countText(session));
        }
    }

    @Test
    void snapshotRestoreUpdatesTheTree() {
        var document = ScalsTestSupport.loadFixture("counter.json");
        try (var session = ScalsEngine.create().open(document)) {
            session.execute("increment").join();
            var snapshot = session.store().snapshot();
            session.execute("increment").join();
            assertEquals("2", countText(session));

            session.store().restore(snapshot);
            assertEquals("1", countText(session));
        }
    }

    @Test
    void nodeActionsRunThroughTheSession() {
        var document = ScalsTestSupport.document("{\"id\":\"d\",\"state\":{\"on\":false},\"root\":{\"children\":["
            + "{\"type\":\"button\",\"id\":\"flip\",\"text\":\"Flip\",\"actions\":{\"onTap\":{\"type\":\"toggleState\",\"path\":\"on\"}}},"
            + "{\"type\":\"label\",\"id\":\"status\",\"text\":\"${on}\"}]}}");
        try (var session = ScalsEngine.create().open(document)) {
            var button = ScalsTestSupport.require(session.tree(), "flip", ButtonNode.class);
            session.execute(button.onTap()).join();
            assertEquals("true", ScalsTestSupport.require(session.tree(), "status", TextNode.class).content());
        }
    }

    @Test
    void requestsCanBeCancelled() {
        var engine = ScalsEngine.create();
        var gate = new CompletableFuture<Void>();
        engine.actionRegistry().register("wait", (definition, ctx, token) -> gate);
        var document = engine.loadJson("{\"id\":\"d\",\"actions\":{\"slow\":{\"type\":\"sequence\",\"steps\":["
            + "{\"type\":\"wait\"},{\"type\":\"setState\",\"path\":\"done\",\"value\":true}]}},"
            + "\"root\":{\"children\":[]}}");
        try (var session = engine.open(document)) {
            var running = session.execute("slow", "request-1");
            assertTrue(session.cancel("request-1"));
            gate.complete(null);
            running.join();
            assertTrue(session.store().get("done").isNull());
            assertFalse(session.cancel("request-1"));
        }
    }

    @Test
    void closedSessionStopsUpdating() {
        var session = ScalsEngine.create().open(ScalsTestSupport.loadFixture("counter.json"));
        var before = session.tree();
        session.close();
        session.store().set("count", 10);
        assertSame(before, session.tree());
    }

    @Test
    void rendersThroughRenderer() {
        try (var session = ScalsEngine.create().open(ScalsTestSupport.loadFixture("counter.json"))) {
            var output = session.render(new DebugRenderer());
            assertTrue(output.contains("\"countLabel\""));
        }
    }

    @Test
    void sessionsAreIndependent() {
        var engine = ScalsEngine.create();
        var document = ScalsTestSupport.loadFixture("counter.json");
        try (var first = engine.open(document); var second = engine.open(document)) {
            first.execute("increment").join();
            assertEquals("1", countText(first));
            assertEquals("0", countText(second));
            assertNotEquals(first.id(), second.id());
        }
    }
}

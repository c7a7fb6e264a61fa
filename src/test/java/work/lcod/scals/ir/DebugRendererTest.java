package work.lcod.scals.ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.scals.resolution.Resolver;
import work.lcod.scals.state.StateStore;
import work.lcod.scals.support.ScalsTestSupport;

class DebugRendererTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private static RenderTree counterTree() {
        var document = ScalsTestSupport.loadFixture("counter.json");
        var store = new StateStore();
        store.initialize(document.state());
        return new Resolver().resolve(document, store).tree();
    }

    @Test
    void rendersKindsAndResolvedContent() throws Exception {
        var output = JSON.readTree(new DebugRenderer().render(counterTree()));

        assertEquals(RenderTree.IR_VERSION, output.path("irVersion").asText());
        var stack = output.path("root").path("children").get(0);
        assertEquals("container", stack.path("kind").asText());
        assertEquals("VSTACK", stack.path("layoutType").asText());

        var countLabel = stack.path("children").get(1);
        assertEquals("text", countLabel.path("kind").asText());
        assertEquals("countLabel", countLabel.path("id").asText());
        assertEquals("0", countLabel.path("content").asText());
        assertEquals("button", stack.path("children").get(2).path("kind").asText());

        assertEquals("setState", output.path("actions").path("increment").path("kind").asText());
        assertFalse(output.has("errors"));
    }

    @Test
    void absentPropertiesAreOmitted() {
        var tree = counterTree();
        var json = new DebugRenderer().toJson(ScalsTestSupport.require(tree, "countLabel", TextNode.class));
        assertEquals("text", json.path("kind").asText());
        assertEquals("${count}", json.path("bindingTemplate").asText());
        assertFalse(json.has("bindingPath"));
        assertFalse(json.has("styleId"));
    }

    @Test
    void errorsAreListedWhenPresent() throws Exception {
        var document = ScalsTestSupport.document("{\"id\":\"d\",\"root\":{\"children\":[{\"type\":\"rating\"}]}}");
        var tree = new Resolver().resolve(document, new StateStore()).tree();
        var output = JSON.readTree(new DebugRenderer().render(tree));
        assertTrue(output.has("errors"));
        assertEquals("unknown_kind", output.path("errors").get(0).path("code").asText());
    }

    @Test
    void rendersUpdatesAsSplices() throws Exception {
        var tree = counterTree();
        var node = tree.nodeAt(List.of(0, 1));
        var update = new RenderUpdate(List.of(new RenderUpdate.Splice(List.of(0, 1), node)));
        var output = JSON.readTree(new DebugRenderer().renderUpdate(tree, update));

        var splice = output.path("splices").get(0);
        assertEquals(0, splice.path("childPath").get(0).asInt());
        assertEquals(1, splice.path("childPath").get(1).asInt());
        assertEquals("countLabel", splice.path("node").path("id").asText());
    }
}

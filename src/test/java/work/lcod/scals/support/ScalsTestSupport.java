package work.lcod.scals.support;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Optional;
import work.lcod.scals.document.DocumentDefinition;
import work.lcod.scals.document.DocumentLoader;
import work.lcod.scals.ir.RenderNode;
import work.lcod.scals.ir.RenderTree;

/**
 * Shared helpers for the test suites: fixture loading and render tree lookups.
 */
public final class ScalsTestSupport {
    private ScalsTestSupport() {}

    public static String fixture(String name) {
        try (InputStream in = ScalsTestSupport.class.getClassLoader().getResourceAsStream("documents/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture documents/" + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read fixture " + name, ex);
        }
    }

    public static DocumentDefinition loadFixture(String name) {
        var loader = new DocumentLoader();
        var content = fixture(name);
        return name.endsWith(".yaml") ? loader.loadYaml(content) : loader.loadJson(content);
    }

    public static DocumentDefinition document(String json) {
        return new DocumentLoader().loadJson(json);
    }

    /** Breadth-first search for a node with the given id. */
    public static Optional<RenderNode> find(RenderTree tree, String id) {
        var pending = new ArrayDeque<RenderNode>(tree.root().children());
        while (!pending.isEmpty()) {
            var node = pending.poll();
            if (id.equals(node.id())) {
                return Optional.of(node);
            }
            node.children().forEach(pending::add);
        }
        return Optional.empty();
    }

    public static <T extends RenderNode> T require(RenderTree tree, String id, Class<T> type) {
        var node = find(tree, id).orElseThrow(() -> new AssertionError("No node '" + id + "' in tree"));
        if (!type.isInstance(node)) {
            throw new AssertionError("Node '" + id + "' is " + node.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(node);
    }
}

package work.lcod.scals.ir;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.io.IOException;
import java.util.List;
import work.lcod.scals.action.ActionKind;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.state.JsonValues;

/**
 * Dumps a render tree as pretty-printed JSON. Every node carries its {@code kind}; absent optional
 * properties are left out.
 */
public final class DebugRenderer implements Renderer<String> {
    private static final ObjectMapper MAPPER = createMapper();

    @Override
    public String render(RenderTree tree) {
        return write(toJson(tree));
    }

    @Override
    public String renderUpdate(RenderTree tree, RenderUpdate update) {
        var splices = MAPPER.createArrayNode();
        for (var splice : update.splices()) {
            var entry = MAPPER.createObjectNode();
            var path = entry.putArray("childPath");
            splice.childPath().forEach(path::add);
            entry.set("node", toJson(splice.node()));
            splices.add(entry);
        }
        var out = MAPPER.createObjectNode();
        out.put("irVersion", tree.irVersion());
        out.set("splices", splices);
        return write(out);
    }

    public JsonNode toJson(RenderTree tree) {
        var out = MAPPER.createObjectNode();
        out.put("irVersion", tree.irVersion());
        ObjectNode root = MAPPER.valueToTree(tree.root());
        annotateChildren(tree.root().children(), (ArrayNode) root.get("children"));
        out.set("root", root);
        out.set("actions", MAPPER.valueToTree(tree.actions()));
        if (!tree.errors().isEmpty()) {
            out.set("errors", MAPPER.valueToTree(tree.errors()));
        }
        return out;
    }

    public JsonNode toJson(RenderNode node) {
        return annotate(node, MAPPER.valueToTree(node));
    }

    // Records carry no type tag, so the kind is added while walking the node and its JSON together.
    private static ObjectNode annotate(RenderNode node, ObjectNode json) {
        var out = MAPPER.createObjectNode();
        out.put("kind", node.kind());
        out.setAll(json);
        if (node instanceof ContainerNode container) {
            annotateChildren(container.children(), (ArrayNode) out.get("children"));
        } else if (node instanceof SectionLayoutNode sections) {
            var sectionsJson = (ArrayNode) out.get("sections");
            for (int i = 0; i < sections.sections().size(); i++) {
                var section = sections.sections().get(i);
                var sectionJson = (ObjectNode) sectionsJson.get(i);
                if (section.header() != null) {
                    sectionJson.set("header", annotate(section.header(), (ObjectNode) sectionJson.get("header")));
                }
                annotateChildren(section.items(), (ArrayNode) sectionJson.get("items"));
                if (section.footer() != null) {
                    sectionJson.set("footer", annotate(section.footer(), (ObjectNode) sectionJson.get("footer")));
                }
            }
        }
        return out;
    }

    private static void annotateChildren(List<RenderNode> children, ArrayNode json) {
        for (int i = 0; i < children.size(); i++) {
            json.set(i, annotate(children.get(i), (ObjectNode) json.get(i)));
        }
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize render tree", ex);
        }
    }

    private static ObjectMapper createMapper() {
        var module = new SimpleModule("scals-ir");
        module.addSerializer(JsonValue.class, new JsonValueSerializer());
        module.addSerializer(ActionKind.class, ToStringSerializer.instance);
        var mapper = new ObjectMapper();
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.registerModule(module);
        return mapper;
    }

    private static final class JsonValueSerializer extends StdSerializer<JsonValue> {
        JsonValueSerializer() {
            super(JsonValue.class);
        }

        @Override
        public void serialize(JsonValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeTree(JsonValues.toNode(value));
        }
    }
}

package work.lcod.scals.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.support.ScalsTestSupport;

class DocumentLoaderTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void loadsJsonDocument() {
        var document = ScalsTestSupport.loadFixture("counter.json");
        assertEquals("counter", document.id());
        assertEquals(DocumentVersion.CURRENT, document.version());
        assertEquals(JsonValue.of(0L), document.state().get("count"));
        assertEquals(24.0, document.styles().get("titleStyle").fontSize());
        assertEquals("setState", document.actions().get("increment").type());
        assertEquals("#FFFFFF", document.root().backgroundColor());

        var stack = assertInstanceOf(Layout.class, document.root().children().get(0));
        assertEquals(Layout.VSTACK, stack.type());
        assertEquals(3, stack.children().size());
        var button = assertInstanceOf(Component.class, stack.children().get(2));
        assertEquals("increment", button.onTap().reference());
    }

    @Test
    void loadsYamlDocument() {
        var document = ScalsTestSupport.loadFixture("todo.yaml");
        assertEquals("todo", document.id());
        assertEquals(2, document.state().get("todos").asArray().orElseThrow().size());

        var repeater = assertInstanceOf(ForEach.class, document.root().children().get(1));
        assertEquals("todos", repeater.items());
        assertEquals("todo", repeater.itemVariable());
        assertEquals("index", repeater.indexVariable());
        assertEquals(Layout.VSTACK, repeater.layout());
        assertInstanceOf(Layout.class, repeater.template());
        assertInstanceOf(Component.class, repeater.emptyView());
    }

    @Test
    void loadsFromPathByExtension(@TempDir Path dir) throws Exception {
        var file = dir.resolve("todo.yml");
        Files.writeString(file, ScalsTestSupport.fixture("todo.yaml"));
        assertEquals("todo", new DocumentLoader().load(file).id());
    }

    @Test
    void emptyShadowAndPaddingAreClearInstructions() {
        var document = ScalsTestSupport.document("{\"id\":\"d\",\"styles\":{\"bare\":{\"shadow\":{},\"padding\":{}}},"
            + "\"root\":{\"children\":[]}}");
        var style = document.styles().get("bare");
        assertTrue(style.shadow().isClear());
        assertTrue(style.padding().isClear());
    }

    @Test
    void customComponentKeepsRawProperties() {
        var document = ScalsTestSupport.document("{\"id\":\"d\",\"root\":{\"children\":["
            + "{\"type\":\"rating\",\"id\":\"stars\",\"maxStars\":5}]}}");
        var component = assertInstanceOf(Component.class, document.root().children().get(0));
        assertEquals("rating", component.kind());
        assertEquals(JsonValue.of(5L), component.properties().get("maxStars"));
    }

    @Test
    void rejectsMissingRoot() {
        var error = assertThrows(DocumentValidationException.class, () -> ScalsTestSupport.document("{\"id\":\"d\"}"));
        assertEquals("invalid_document", error.code());
        assertEquals(1, error.issues().size());
        assertEquals(ValidationIssue.Kind.MISSING_FIELD, error.issues().get(0).kind());
        assertEquals("$", error.issues().get(0).path());
    }

    @Test
    void rejectsUnsupportedMajorVersion() {
        var error = assertThrows(DocumentValidationException.class,
            () -> ScalsTestSupport.document("{\"id\":\"d\",\"version\":\"2.0.0\",\"root\":{\"children\":[]}}"));
        assertEquals(ValidationIssue.Kind.UNSUPPORTED_VERSION, error.issues().get(0).kind());
        assertEquals("$.version", error.issues().get(0).path());
    }

    @Test
    void acceptsNewerMinorVersion() {
        var document = ScalsTestSupport.document("{\"id\":\"d\",\"version\":\"1.4\",\"root\":{\"children\":[]}}");
        assertEquals(new DocumentVersion(1, 4, 0), document.version());
    }

    @Test
    void reportsEveryIssueAtOnce() throws Exception {
        var tree = JSON.readTree("{\"root\":{\"children\":["
            + "{\"type\":\"forEach\"},"
            + "{\"type\":\"label\",\"style\":{\"fontWeight\":\"heavyish\"}},"
            + "{\"type\":\"sectionLayout\",\"sections\":[{\"layout\":{\"type\":\"list\"},\"children\":[],\"dataSource\":\"x\"}]}"
            + "]}}");
        var result = new DocumentValidator().validate(tree);
        assertFalse(result.isValid());

        var paths = result.errors().stream().map(issue -> issue.path() + " " + issue.kind()).toList();
        assertTrue(paths.contains("$ MISSING_FIELD"));
        assertTrue(paths.contains("$.root.children[0] MISSING_FIELD"));
        assertTrue(paths.contains("$.root.children[1].style.fontWeight INVALID_ENUM"));
        assertTrue(paths.contains("$.root.children[2].sections[0] MUTUALLY_EXCLUSIVE"));
    }

    @Test
    void unknownComponentsWarnUnlessDisallowed() throws Exception {
        var tree = JSON.readTree("{\"id\":\"d\",\"root\":{\"children\":[{\"type\":\"rating\"}]}}");

        var lenient = new DocumentValidator().validate(tree);
        assertTrue(lenient.isValid());
        assertEquals(1, lenient.warnings().size());

        var strict = new DocumentValidator(
            DocumentValidator.BUILT_IN_COMPONENTS, DocumentValidator.BUILT_IN_ACTIONS, false, true
        ).validate(tree);
        assertEquals(ValidationIssue.Kind.UNKNOWN_COMPONENT, strict.errors().get(0).kind());
    }

    @Test
    void registeredCustomComponentsAreKnown() throws Exception {
        var tree = JSON.readTree("{\"id\":\"d\",\"root\":{\"children\":[{\"type\":\"rating\"}]}}");
        var validator = new DocumentValidator(Set.of("rating"), Set.of(), false, false);
        var result = validator.validate(tree);
        assertTrue(result.isValid());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void unknownActionsAreRejectedWhenDisallowed() throws Exception {
        var tree = JSON.readTree("{\"id\":\"d\",\"actions\":{\"go\":{\"type\":\"teleport\"}},\"root\":{\"children\":[]}}");
        var strict = new DocumentValidator(
            DocumentValidator.BUILT_IN_COMPONENTS, DocumentValidator.BUILT_IN_ACTIONS, true, false
        ).validate(tree);
        assertEquals(ValidationIssue.Kind.UNKNOWN_ACTION, strict.errors().get(0).kind());
        assertEquals("$.actions.go", strict.errors().get(0).path());
    }

    @Test
    void openUrlNeedsUrl() throws Exception {
        var tree = JSON.readTree("{\"id\":\"d\",\"actions\":{\"go\":{\"type\":\"openURL\"}},\"root\":{\"children\":[]}}");
        var result = new DocumentValidator().validate(tree);
        assertEquals(ValidationIssue.Kind.MISSING_FIELD, result.errors().get(0).kind());
        assertEquals("$.actions.go", result.errors().get(0).path());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void malformedColorsAreFormatIssues() throws Exception {
        var tree = JSON.readTree("{\"id\":\"d\",\"styles\":{\"s\":{\"textColor\":\"rgb(1.2.3, 0, 0)\","
            + "\"shadow\":{\"color\":\"#12\"}}},\"root\":{\"children\":["
            + "{\"type\":\"gradient\",\"gradientColors\":[{\"lightColor\":\"#FFFFFF\",\"darkColor\":\"night\",\"location\":0}]},"
            + "{\"type\":\"pageIndicator\",\"currentPage\":\"page\",\"currentDotColor\":\"rgb(0,0)\"}]}}");
        var result = new DocumentValidator().validate(tree);

        var paths = result.errors().stream().map(issue -> issue.path() + " " + issue.kind()).toList();
        assertEquals(List.of(
            "$.root.children[0].gradientColors[0].darkColor INVALID_FORMAT",
            "$.root.children[1].currentDotColor INVALID_FORMAT",
            "$.styles.s.textColor INVALID_FORMAT",
            "$.styles.s.shadow.color INVALID_FORMAT"
        ), paths);
    }

    @Test
    void malformedInputIsAFormatIssue() {
        var error = assertThrows(DocumentValidationException.class, () -> new DocumentLoader().loadJson("{not json"));
        assertEquals(ValidationIssue.Kind.INVALID_FORMAT, error.issues().get(0).kind());
    }

    @Test
    void absentOptionalsAreNull() {
        var document = ScalsTestSupport.document("{\"id\":\"d\",\"root\":{\"children\":[{\"type\":\"label\",\"text\":\"Hi\"}]}}");
        var label = assertInstanceOf(Component.class, document.root().children().get(0));
        assertNull(label.styleId());
        assertNull(label.onTap());
        assertTrue(document.actions().isEmpty());
    }
}

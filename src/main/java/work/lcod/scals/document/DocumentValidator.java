package work.lcod.scals.document;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.lcod.scals.ir.Color;
import work.lcod.scals.ir.FontWeight;
import work.lcod.scals.ir.TextAlignment;

/**
 * Structural validation of a wire document, run on the raw Jackson tree before any model is
 * built. All problems are collected; nothing stops at the first error.
 */
public final class DocumentValidator {
    public static final Set<String> BUILT_IN_COMPONENTS = Set.of(
        "label", "text", "button", "textfield", "image", "gradient", "toggle", "slider", "divider",
        "shape", "pageIndicator"
    );
    public static final Set<String> BUILT_IN_ACTIONS = Set.of(
        "dismiss", "setState", "toggleState", "showAlert", "navigate", "openURL", "sequence",
        "appendToArray", "removeFromArray", "toggleInArray", "setArrayItem", "clearArray"
    );

    private static final List<String> LAYOUT_TYPES = List.of("vstack", "hstack", "zstack");
    private static final List<String> SECTION_TYPES = List.of("horizontal", "list", "grid", "flow");
    private static final List<String> COLOR_SCHEMES = List.of("light", "dark", "system");
    private static final List<String> SNAP_BEHAVIORS = List.of("none", "viewAligned", "paging");
    private static final List<String> HORIZONTAL = List.of("leading", "center", "trailing");
    private static final List<String> VERTICAL = List.of("top", "center", "bottom");
    private static final List<String> DATA_TYPES = List.of("static", "binding", "localBinding");
    private static final List<String> PADDING_FIELDS =
        List.of("top", "bottom", "leading", "trailing", "horizontal", "vertical", "all");
    private static final List<String> STYLE_NUMBERS =
        List.of("fontSize", "cornerRadius", "borderWidth");
    private static final List<String> STYLE_COLORS =
        List.of("textColor", "backgroundColor", "borderColor", "tintColor");
    private static final List<String> IMAGE_SOURCES = List.of("sfsymbol", "system", "url", "asset", "statePath");

    private final Set<String> knownComponents;
    private final Set<String> knownActions;
    private final boolean allowUnknownComponents;
    private final boolean allowUnknownActions;

    public DocumentValidator() {
        this(BUILT_IN_COMPONENTS, BUILT_IN_ACTIONS, true, true);
    }

    public DocumentValidator(
        Set<String> knownComponents,
        Set<String> knownActions,
        boolean allowUnknownComponents,
        boolean allowUnknownActions
    ) {
        this.knownComponents = Set.copyOf(knownComponents);
        this.knownActions = Set.copyOf(knownActions);
        this.allowUnknownComponents = allowUnknownComponents;
        this.allowUnknownActions = allowUnknownActions;
    }

    public ValidationResult validate(JsonNode document) {
        var issues = new Issues();
        if (document == null || !document.isObject()) {
            issues.error("$", ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(document));
            return issues.result();
        }
        requireString(document, "id", "$", issues);
        validateVersion(document.get("version"), issues);

        var root = document.get("root");
        if (root == null) {
            issues.error("$", ValidationIssue.Kind.MISSING_FIELD, "missing required field 'root'");
        } else if (!root.isObject()) {
            issues.error("$.root", ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(root));
        } else {
            validateRoot(root, "$.root", issues);
        }

        var state = document.get("state");
        if (state != null && !state.isObject()) {
            issues.error("$.state", ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(state));
        }
        var styles = document.get("styles");
        if (styles != null) {
            if (!styles.isObject()) {
                issues.error("$.styles", ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(styles));
            } else {
                styles.fields().forEachRemaining(e -> validateStyle(e.getValue(), "$.styles." + e.getKey(), issues));
            }
        }
        var dataSources = document.get("dataSources");
        if (dataSources != null && dataSources.isObject()) {
            dataSources.fields().forEachRemaining(e ->
                validateDataReference(e.getValue(), "$.dataSources." + e.getKey(), issues));
        }
        var actions = document.get("actions");
        if (actions != null) {
            if (!actions.isObject()) {
                issues.error("$.actions", ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(actions));
            } else {
                actions.fields().forEachRemaining(e -> validateAction(e.getValue(), "$.actions." + e.getKey(), issues));
            }
        }
        return issues.result();
    }

    private void validateVersion(JsonNode version, Issues issues) {
        if (version == null) {
            return;
        }
        if (!version.isTextual()) {
            issues.error("$.version", ValidationIssue.Kind.TYPE_MISMATCH, "expected string, got " + typeName(version));
            return;
        }
        DocumentVersion parsed;
        try {
            parsed = DocumentVersion.parse(version.textValue());
        } catch (IllegalArgumentException ex) {
            issues.error("$.version", ValidationIssue.Kind.INVALID_FORMAT, ex.getMessage());
            return;
        }
        if (!parsed.isSupported()) {
            issues.error("$.version", ValidationIssue.Kind.UNSUPPORTED_VERSION,
                "document version " + parsed + " is not supported (expected " + DocumentVersion.CURRENT.major() + ".x)");
        }
    }

    private void validateRoot(JsonNode root, String path, Issues issues) {
        var children = root.get("children");
        if (children == null) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'children'");
        } else {
            validateChildren(children, path + ".children", issues);
        }
        checkEnum(root, "colorScheme", COLOR_SCHEMES, path, issues);
        checkColor(root, "backgroundColor", path, issues);
        var actions = root.get("actions");
        if (actions != null && actions.isObject()) {
            validateBinding(actions.get("onAppear"), path + ".actions.onAppear", issues);
            validateBinding(actions.get("onDisappear"), path + ".actions.onDisappear", issues);
        }
    }

    private void validateChildren(JsonNode children, String path, Issues issues) {
        if (!children.isArray()) {
            issues.error(path, ValidationIssue.Kind.TYPE_MISMATCH, "expected array, got " + typeName(children));
            return;
        }
        for (int i = 0; i < children.size(); i++) {
            validateNode(children.get(i), path + "[" + i + "]", issues);
        }
    }

    private void validateNode(JsonNode node, String path, Issues issues) {
        if (node == null || !node.isObject()) {
            issues.error(path, ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(node));
            return;
        }
        var type = node.get("type");
        if (type == null) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'type'");
            return;
        }
        if (!type.isTextual()) {
            issues.error(path + ".type", ValidationIssue.Kind.TYPE_MISMATCH, "expected string, got " + typeName(type));
            return;
        }
        validatePadding(node.get("padding"), path + ".padding", issues);
        switch (type.textValue()) {
            case "spacer":
                checkNumber(node, "minLength", path, issues);
                break;
            case "vstack":
            case "hstack":
            case "zstack":
                validateAlignment(node.get("alignment"), path + ".alignment", issues);
                checkNumber(node, "spacing", path, issues);
                if (node.has("style")) {
                    validateStyle(node.get("style"), path + ".style", issues);
                }
                if (node.has("children")) {
                    validateChildren(node.get("children"), path + ".children", issues);
                }
                break;
            case "sectionLayout":
                validateSectionLayout(node, path, issues);
                break;
            case "forEach":
                validateForEach(node, path, issues);
                break;
            default:
                validateComponent(node, type.textValue(), path, issues);
        }
    }

    private void validateAlignment(JsonNode alignment, String path, Issues issues) {
        if (alignment == null || alignment.isTextual()) {
            return;
        }
        if (!alignment.isObject()) {
            issues.error(path, ValidationIssue.Kind.TYPE_MISMATCH, "expected string or object, got " + typeName(alignment));
            return;
        }
        checkEnum(alignment, "horizontal", HORIZONTAL, path, issues);
        checkEnum(alignment, "vertical", VERTICAL, path, issues);
    }

    private void validateForEach(JsonNode node, String path, Issues issues) {
        requireString(node, "items", path, issues);
        var template = node.get("template");
        if (template == null) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'template'");
        } else {
            validateNode(template, path + ".template", issues);
        }
        checkEnum(node, "layout", LAYOUT_TYPES, path, issues);
        validateAlignment(node.get("alignment"), path + ".alignment", issues);
        if (node.has("emptyView")) {
            validateNode(node.get("emptyView"), path + ".emptyView", issues);
        }
    }

    private void validateSectionLayout(JsonNode node, String path, Issues issues) {
        var sections = node.get("sections");
        if (sections == null) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'sections'");
            return;
        }
        if (!sections.isArray()) {
            issues.error(path + ".sections", ValidationIssue.Kind.TYPE_MISMATCH, "expected array, got " + typeName(sections));
            return;
        }
        for (int i = 0; i < sections.size(); i++) {
            validateSection(sections.get(i), path + ".sections[" + i + "]", issues);
        }
    }

    private void validateSection(JsonNode section, String path, Issues issues) {
        var layout = section.get("layout");
        if (layout == null) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'layout'");
        } else if (!layout.isObject()) {
            issues.error(path + ".layout", ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(layout));
        } else {
            var layoutPath = path + ".layout";
            if (layout.get("type") == null) {
                issues.error(layoutPath, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'type'");
            }
            checkEnum(layout, "type", SECTION_TYPES, layoutPath, issues);
            checkEnum(layout, "snapBehavior", SNAP_BEHAVIORS, layoutPath, issues);
            checkEnum(layout, "alignment", HORIZONTAL, layoutPath, issues);
            var columns = layout.get("columns");
            if (columns != null && columns.isNumber() && columns.intValue() < 1) {
                issues.error(layoutPath + ".columns", ValidationIssue.Kind.OUT_OF_RANGE,
                    "column count " + columns.intValue() + " must be at least 1");
            }
            validatePadding(layout.get("contentInsets"), layoutPath + ".contentInsets", issues);
        }
        var hasChildren = section.has("children");
        var hasDataSource = section.has("dataSource");
        if (hasChildren && hasDataSource) {
            issues.error(path, ValidationIssue.Kind.MUTUALLY_EXCLUSIVE,
                "fields 'children' and 'dataSource' are mutually exclusive");
        }
        if (hasChildren) {
            validateChildren(section.get("children"), path + ".children", issues);
        }
        if (hasDataSource && !section.has("itemTemplate")) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'itemTemplate' for 'dataSource'");
        }
        if (section.has("itemTemplate")) {
            validateNode(section.get("itemTemplate"), path + ".itemTemplate", issues);
        }
        if (section.has("header")) {
            validateNode(section.get("header"), path + ".header", issues);
        }
        if (section.has("footer")) {
            validateNode(section.get("footer"), path + ".footer", issues);
        }
    }

    private void validateComponent(JsonNode node, String type, String path, Issues issues) {
        if (!knownComponents.contains(type)) {
            if (allowUnknownComponents) {
                issues.warn("Unknown component type '" + type + "' at " + path + " requires a custom resolver");
            } else {
                issues.error(path, ValidationIssue.Kind.UNKNOWN_COMPONENT, "unknown component type '" + type + "'");
            }
        }
        if (node.has("style")) {
            validateStyle(node.get("style"), path + ".style", issues);
        }
        var image = node.get("image");
        if (image != null && image.isObject()) {
            var sources = IMAGE_SOURCES.stream().filter(image::has).count();
            if (sources == 0 && !image.path("activityIndicator").asBoolean(false)) {
                issues.error(path + ".image", ValidationIssue.Kind.MISSING_FIELD,
                    "missing image source (one of " + String.join(", ", IMAGE_SOURCES) + ")");
            } else if (sources > 1) {
                issues.error(path + ".image", ValidationIssue.Kind.MUTUALLY_EXCLUSIVE,
                    "only one image source may be given");
            }
        }
        var gradientColors = node.get("gradientColors");
        if (gradientColors != null && gradientColors.isArray()) {
            for (int i = 0; i < gradientColors.size(); i++) {
                validateColorStop(gradientColors.get(i), path + ".gradientColors[" + i + "]", issues);
            }
        }
        checkColor(node, "dotColor", path, issues);
        checkColor(node, "currentDotColor", path, issues);
        var min = node.get("minValue");
        var max = node.get("maxValue");
        if (min != null && max != null && min.isNumber() && max.isNumber() && min.doubleValue() > max.doubleValue()) {
            issues.error(path + ".minValue", ValidationIssue.Kind.OUT_OF_RANGE,
                "minValue " + min.doubleValue() + " exceeds maxValue " + max.doubleValue());
        }
        var data = node.get("data");
        if (data != null && data.isObject()) {
            data.fields().forEachRemaining(e -> validateDataReference(e.getValue(), path + ".data." + e.getKey(), issues));
        }
        var actions = node.get("actions");
        if (actions != null && actions.isObject()) {
            actions.fields().forEachRemaining(e -> validateBinding(e.getValue(), path + ".actions." + e.getKey(), issues));
        }
    }

    private void validateColorStop(JsonNode stop, String path, Issues issues) {
        var location = stop.get("location");
        if (location == null) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'location'");
        } else if (!location.isNumber()) {
            issues.error(path + ".location", ValidationIssue.Kind.TYPE_MISMATCH, "expected number, got " + typeName(location));
        } else if (location.doubleValue() < 0 || location.doubleValue() > 1) {
            issues.error(path + ".location", ValidationIssue.Kind.OUT_OF_RANGE,
                "value " + location.doubleValue() + " outside [0, 1]");
        }
        checkColor(stop, "color", path, issues);
        checkColor(stop, "lightColor", path, issues);
        checkColor(stop, "darkColor", path, issues);
        var fixed = stop.has("color");
        var adaptive = stop.has("lightColor") || stop.has("darkColor");
        if (fixed && adaptive) {
            issues.error(path, ValidationIssue.Kind.MUTUALLY_EXCLUSIVE,
                "'color' cannot be combined with 'lightColor'/'darkColor'");
        } else if (!fixed && !adaptive) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'color'");
        }
    }

    private void validateDataReference(JsonNode reference, String path, Issues issues) {
        if (!reference.isObject()) {
            issues.error(path, ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(reference));
            return;
        }
        checkEnum(reference, "type", DATA_TYPES, path, issues);
        if (reference.has("path") && reference.has("template")) {
            issues.error(path, ValidationIssue.Kind.MUTUALLY_EXCLUSIVE, "fields 'path' and 'template' are mutually exclusive");
        }
    }

    private void validateStyle(JsonNode style, String path, Issues issues) {
        if (!style.isObject()) {
            issues.error(path, ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(style));
            return;
        }
        checkEnum(style, "fontWeight", FontWeight.wireNames(), path, issues);
        checkEnum(style, "textAlignment", TextAlignment.WIRE_NAMES, path, issues);
        var inherits = style.get("inherits");
        if (inherits != null && !inherits.isTextual()) {
            issues.error(path + ".inherits", ValidationIssue.Kind.TYPE_MISMATCH, "expected string, got " + typeName(inherits));
        }
        for (var field : STYLE_NUMBERS) {
            checkNumber(style, field, path, issues);
        }
        var fontSize = style.get("fontSize");
        if (fontSize != null && fontSize.isNumber() && fontSize.doubleValue() <= 0) {
            issues.error(path + ".fontSize", ValidationIssue.Kind.OUT_OF_RANGE, "fontSize must be positive");
        }
        for (var field : STYLE_COLORS) {
            checkColor(style, field, path, issues);
        }
        var shadow = style.get("shadow");
        if (shadow != null && !shadow.isObject()) {
            issues.error(path + ".shadow", ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(shadow));
        } else if (shadow != null) {
            checkColor(shadow, "color", path + ".shadow", issues);
        }
        validatePadding(style.get("padding"), path + ".padding", issues);
    }

    private void validatePadding(JsonNode padding, String path, Issues issues) {
        if (padding == null || padding.isNumber()) {
            return;
        }
        if (!padding.isObject()) {
            issues.error(path, ValidationIssue.Kind.TYPE_MISMATCH, "expected number or object, got " + typeName(padding));
            return;
        }
        for (var field : PADDING_FIELDS) {
            checkNumber(padding, field, path, issues);
        }
    }

    private void validateBinding(JsonNode binding, String path, Issues issues) {
        if (binding == null || binding.isTextual()) {
            return;
        }
        validateAction(binding, path, issues);
    }

    private void validateAction(JsonNode action, String path, Issues issues) {
        if (!action.isObject()) {
            issues.error(path, ValidationIssue.Kind.TYPE_MISMATCH, "expected object, got " + typeName(action));
            return;
        }
        var type = action.get("type");
        if (type == null || !type.isTextual()) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'type'");
            return;
        }
        var kind = type.textValue();
        if (!knownActions.contains(kind)) {
            if (allowUnknownActions) {
                issues.warn("Unknown action type '" + kind + "' at " + path + " requires a custom handler");
            } else {
                issues.error(path, ValidationIssue.Kind.UNKNOWN_ACTION, "unknown action type '" + kind + "'");
            }
        }
        switch (kind) {
            case "setState":
            case "toggleState":
            case "appendToArray":
            case "removeFromArray":
            case "toggleInArray":
            case "setArrayItem":
            case "clearArray":
                requireString(action, "path", path, issues);
                break;
            case "navigate":
                requireString(action, "destination", path, issues);
                break;
            case "openURL":
                requireString(action, "url", path, issues);
                break;
            case "sequence":
                var steps = action.get("steps");
                if (steps == null) {
                    issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field 'steps'");
                } else if (!steps.isArray()) {
                    issues.error(path + ".steps", ValidationIssue.Kind.TYPE_MISMATCH, "expected array, got " + typeName(steps));
                } else {
                    for (int i = 0; i < steps.size(); i++) {
                        validateAction(steps.get(i), path + ".steps[" + i + "]", issues);
                    }
                }
                break;
            default:
                break;
        }
    }

    private static void requireString(JsonNode node, String field, String path, Issues issues) {
        var value = node.get(field);
        if (value == null) {
            issues.error(path, ValidationIssue.Kind.MISSING_FIELD, "missing required field '" + field + "'");
        } else if (!value.isTextual()) {
            issues.error(path + "." + field, ValidationIssue.Kind.TYPE_MISMATCH, "expected string, got " + typeName(value));
        }
    }

    private static void checkNumber(JsonNode node, String field, String path, Issues issues) {
        var value = node.get(field);
        if (value != null && !value.isNumber()) {
            issues.error(path + "." + field, ValidationIssue.Kind.TYPE_MISMATCH, "expected number, got " + typeName(value));
        }
    }

    private static void checkColor(JsonNode node, String field, String path, Issues issues) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.isTextual()) {
            issues.error(path + "." + field, ValidationIssue.Kind.TYPE_MISMATCH, "expected string, got " + typeName(value));
        } else if (!Color.isValid(value.textValue())) {
            issues.error(path + "." + field, ValidationIssue.Kind.INVALID_FORMAT, "invalid color '" + value.textValue() + "'");
        }
    }

    private static void checkEnum(JsonNode node, String field, List<String> allowed, String path, Issues issues) {
        var value = node.get(field);
        if (value == null) {
            return;
        }
        if (!value.isTextual()) {
            issues.error(path + "." + field, ValidationIssue.Kind.TYPE_MISMATCH, "expected string, got " + typeName(value));
        } else if (!allowed.contains(value.textValue())) {
            issues.error(path + "." + field, ValidationIssue.Kind.INVALID_ENUM,
                "invalid value '" + value.textValue() + "', allowed: " + String.join(", ", allowed));
        }
    }

    private static String typeName(JsonNode node) {
        if (node == null || node.isMissingNode()) return "nothing";
        if (node.isNull()) return "null";
        if (node.isTextual()) return "string";
        if (node.isBoolean()) return "boolean";
        if (node.isNumber()) return "number";
        if (node.isArray()) return "array";
        return "object";
    }

    private static final class Issues {
        private final List<ValidationIssue> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        void error(String path, ValidationIssue.Kind kind, String message) {
            errors.add(new ValidationIssue(path, kind, message));
        }

        void warn(String message) {
            warnings.add(message);
        }

        ValidationResult result() {
            return new ValidationResult(errors, warnings);
        }
    }
}

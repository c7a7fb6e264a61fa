package work.lcod.scals.document;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import work.lcod.scals.ir.Alignment;
import work.lcod.scals.ir.Dimension;
import work.lcod.scals.ir.FontWeight;
import work.lcod.scals.ir.SafeAreaInsets;
import work.lcod.scals.ir.TextAlignment;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.state.JsonValues;

/**
 * Maps a validated Jackson tree onto the immutable document model. Equivalent surface syntaxes
 * (numeric padding, alignment shortcuts, numeric dimensions) collapse here. Unknown enum values
 * fall back to their defaults instead of failing.
 */
public final class DocumentParser {
    private DocumentParser() {}

    public static DocumentDefinition parse(JsonNode root) {
        var state = new LinkedHashMap<String, JsonValue>();
        forEachField(root.get("state"), (key, value) -> state.put(key, JsonValues.fromNode(value)));

        var styles = new LinkedHashMap<String, Style>();
        forEachField(root.get("styles"), (key, value) -> styles.put(key, parseStyle(value)));

        var dataSources = new LinkedHashMap<String, DataReference>();
        forEachField(root.get("dataSources"), (key, value) -> dataSources.put(key, parseDataReference(value)));

        var actions = new LinkedHashMap<String, DocumentAction>();
        forEachField(root.get("actions"), (key, value) -> {
            var action = parseAction(value);
            if (action != null) {
                actions.put(key, action);
            }
        });

        var version = text(root, "version");
        return new DocumentDefinition(
            text(root, "id"),
            version == null ? DocumentVersion.CURRENT : DocumentVersion.parse(version),
            state,
            styles,
            dataSources,
            actions,
            parseRoot(root.get("root"))
        );
    }

    public static RootComponent parseRoot(JsonNode node) {
        var actions = node.get("actions");
        return new RootComponent(
            text(node, "backgroundColor"),
            parseSafeAreaInsets(node.get("edgeInsets")),
            text(node, "styleId"),
            text(node, "colorScheme"),
            actions == null ? null : parseBinding(actions.get("onAppear")),
            actions == null ? null : parseBinding(actions.get("onDisappear")),
            parseChildren(node.get("children"))
        );
    }

    public static LayoutNode parseNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        var type = text(node, "type");
        if (type == null) {
            return null;
        }
        switch (type) {
            case Layout.VSTACK:
            case Layout.HSTACK:
            case Layout.ZSTACK:
                return new Layout(
                    type,
                    parseAlignment(node.get("alignment")),
                    number(node, "spacing"),
                    parsePadding(node.get("padding")),
                    text(node, "styleId"),
                    node.has("style") ? parseStyle(node.get("style")) : null,
                    parseValues(node.get("state")),
                    parseChildren(node.get("children"))
                );
            case SectionLayout.KIND:
                return parseSectionLayout(node);
            case ForEach.KIND:
                return new ForEach(
                    text(node, "items"),
                    text(node, "itemVariable"),
                    text(node, "indexVariable"),
                    text(node, "layout"),
                    number(node, "spacing"),
                    parseAlignment(node.get("alignment")),
                    parsePadding(node.get("padding")),
                    parseNode(node.get("template")),
                    parseNode(node.get("emptyView"))
                );
            case Spacer.KIND:
                return new Spacer(number(node, "minLength"), number(node, "width"), number(node, "height"));
            default:
                return parseComponent(node);
        }
    }

    public static Style parseStyle(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Style.EMPTY;
        }
        return Style.builder()
            .inherits(text(node, "inherits"))
            .fontFamily(text(node, "fontFamily"))
            .fontSize(number(node, "fontSize"))
            .fontWeight(FontWeight.fromWireName(text(node, "fontWeight")))
            .textColor(text(node, "textColor"))
            .textAlignment(TextAlignment.fromWireName(text(node, "textAlignment")))
            .backgroundColor(text(node, "backgroundColor"))
            .cornerRadius(number(node, "cornerRadius"))
            .borderWidth(number(node, "borderWidth"))
            .borderColor(text(node, "borderColor"))
            .shadow(parseShadow(node.get("shadow")))
            .tintColor(text(node, "tintColor"))
            .width(parseDimension(node.get("width")))
            .height(parseDimension(node.get("height")))
            .minWidth(parseDimension(node.get("minWidth")))
            .minHeight(parseDimension(node.get("minHeight")))
            .maxWidth(parseDimension(node.get("maxWidth")))
            .maxHeight(parseDimension(node.get("maxHeight")))
            .padding(parsePadding(node.get("padding")))
            .build();
    }

    /** {@code null} when absent; a bare number means every edge. */
    public static Padding parsePadding(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Padding.uniform(node.doubleValue());
        }
        return new Padding(
            number(node, "top"),
            number(node, "bottom"),
            number(node, "leading"),
            number(node, "trailing"),
            number(node, "horizontal"),
            number(node, "vertical"),
            number(node, "all")
        );
    }

    public static Alignment parseAlignment(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return Alignment.fromShortcut(node.textValue());
        }
        return Alignment.of(text(node, "horizontal"), text(node, "vertical"));
    }

    public static Dimension parseDimension(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Dimension.absolute(node.doubleValue());
        }
        var fractional = number(node, "fractional");
        if (fractional != null) {
            return Dimension.fractional(fractional);
        }
        var absolute = number(node, "absolute");
        return absolute == null ? null : Dimension.absolute(absolute);
    }

    public static DocumentAction parseAction(JsonNode node) {
        if (node == null || !node.isObject() || text(node, "type") == null) {
            return null;
        }
        var parameters = new LinkedHashMap<String, JsonValue>();
        node.fields().forEachRemaining(entry -> {
            if (!"type".equals(entry.getKey())) {
                parameters.put(entry.getKey(), JsonValues.fromNode(entry.getValue()));
            }
        });
        return new DocumentAction(text(node, "type"), JsonValue.object(parameters));
    }

    public static ActionBinding parseBinding(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return ActionBinding.reference(node.textValue());
        }
        var inline = parseAction(node);
        return inline == null ? null : ActionBinding.inline(inline);
    }

    static DataReference parseDataReference(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        var path = text(node, "path");
        var template = text(node, "template");
        var rawType = text(node, "type");
        DataReference.Type type;
        if ("localBinding".equals(rawType)) {
            type = DataReference.Type.LOCAL_BINDING;
        } else if ("binding".equals(rawType) || (rawType == null && (path != null || template != null))) {
            type = DataReference.Type.BINDING;
        } else {
            type = DataReference.Type.STATIC;
        }
        var value = node.get("value");
        return new DataReference(
            type,
            value == null || value.isNull() ? null : value.asText(),
            path,
            template
        );
    }

    private static Component parseComponent(JsonNode node) {
        var data = new LinkedHashMap<String, DataReference>();
        forEachField(node.get("data"), (key, value) -> {
            var reference = parseDataReference(value);
            if (reference != null) {
                data.put(key, reference);
            }
        });
        var actions = node.get("actions");
        var styles = node.get("styles");
        return new Component(
            text(node, "type"),
            text(node, "id"),
            text(node, "styleId"),
            node.has("style") ? parseStyle(node.get("style")) : null,
            styles == null || !styles.isObject()
                ? null
                : new Component.StateStyles(text(styles, "normal"), text(styles, "selected"), text(styles, "disabled")),
            parsePadding(node.get("padding")),
            text(node, "text"),
            text(node, "placeholder"),
            text(node, "bind"),
            text(node, "dataSourceId"),
            data,
            actions == null ? null : parseBinding(actions.get("onTap")),
            actions == null ? null : parseBinding(actions.get("onValueChanged")),
            text(node, "isSelectedBinding"),
            bool(node, "fillWidth"),
            parseValues(node.get("state")),
            number(node, "minValue"),
            number(node, "maxValue"),
            parseImage(node.get("image")),
            text(node, "imagePlacement"),
            number(node, "imageSpacing"),
            text(node, "buttonShape"),
            text(node, "shapeType"),
            number(node, "cornerRadius"),
            parseGradient(node),
            parsePageIndicator(node),
            (JsonValue.ObjectValue) JsonValues.fromNode(node)
        );
    }

    private static Component.ImageSpec parseImage(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        var symbol = text(node, "sfsymbol");
        return new Component.ImageSpec(
            symbol != null ? symbol : text(node, "system"),
            text(node, "asset"),
            text(node, "url"),
            text(node, "statePath"),
            bool(node, "activityIndicator"),
            text(node, "placeholder")
        );
    }

    private static Component.GradientSpec parseGradient(JsonNode node) {
        var colors = node.get("gradientColors");
        if (colors == null || !colors.isArray()) {
            return null;
        }
        var stops = new ArrayList<Component.ColorStop>();
        colors.forEach(stop -> stops.add(new Component.ColorStop(
            text(stop, "color"),
            text(stop, "lightColor"),
            text(stop, "darkColor"),
            number(stop, "location")
        )));
        return new Component.GradientSpec(
            text(node, "gradientType"),
            stops,
            text(node, "gradientStart"),
            text(node, "gradientEnd")
        );
    }

    private static Component.PageIndicatorSpec parsePageIndicator(JsonNode node) {
        if (!node.has("currentPage") && !node.has("pageCount")) {
            return null;
        }
        return new Component.PageIndicatorSpec(
            text(node, "currentPage"),
            JsonValues.fromNode(node.get("pageCount")),
            number(node, "dotSize"),
            number(node, "dotSpacing"),
            text(node, "dotColor"),
            text(node, "currentDotColor")
        );
    }

    private static SectionLayout parseSectionLayout(JsonNode node) {
        var sections = new ArrayList<SectionLayout.Section>();
        var rawSections = node.get("sections");
        if (rawSections != null && rawSections.isArray()) {
            for (var section : rawSections) {
                var children = section.has("children") ? parseChildren(section.get("children")) : List.<LayoutNode>of();
                sections.add(new SectionLayout.Section(
                    text(section, "id"),
                    parseSectionConfig(section.get("layout")),
                    parseNode(section.get("header")),
                    parseNode(section.get("footer")),
                    bool(section, "stickyHeader"),
                    children,
                    text(section, "dataSource"),
                    parseNode(section.get("itemTemplate")),
                    text(section, "itemVariable"),
                    text(section, "indexVariable")
                ));
            }
        }
        return new SectionLayout(text(node, "id"), number(node, "sectionSpacing"), sections);
    }

    private static SectionLayout.Config parseSectionConfig(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new SectionLayout.Config("list", null, null, null, null, null, null, null, null, null, null);
        }
        var dimensions = node.get("itemDimensions");
        return new SectionLayout.Config(
            text(node, "type"),
            text(node, "alignment"),
            number(node, "itemSpacing"),
            number(node, "lineSpacing"),
            parsePadding(node.get("contentInsets")),
            dimensions == null || !dimensions.isObject()
                ? null
                : new SectionLayout.ItemDimensions(
                    parseDimension(dimensions.get("width")),
                    parseDimension(dimensions.get("height")),
                    number(dimensions, "aspectRatio")
                ),
            optionalBool(node, "showsIndicators"),
            optionalBool(node, "isPagingEnabled"),
            text(node, "snapBehavior"),
            parseColumns(node.get("columns")),
            optionalBool(node, "showsDividers")
        );
    }

    private static SectionLayout.Columns parseColumns(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return new SectionLayout.Columns(node.intValue(), null);
        }
        var adaptive = node.get("adaptive");
        if (adaptive != null && adaptive.isObject()) {
            return new SectionLayout.Columns(null, number(adaptive, "minWidth"));
        }
        var fixed = node.get("fixed");
        return fixed != null && fixed.isNumber() ? new SectionLayout.Columns(fixed.intValue(), null) : null;
    }

    private static SafeAreaInsets parseSafeAreaInsets(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        var insets = new SafeAreaInsets(
            parseInset(node.get("top")),
            parseInset(node.get("bottom")),
            parseInset(node.get("leading")),
            parseInset(node.get("trailing"))
        );
        return insets.isEmpty() ? null : insets;
    }

    private static SafeAreaInsets.Inset parseInset(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return new SafeAreaInsets.Inset(SafeAreaInsets.Positioning.SAFE_AREA, node.doubleValue());
        }
        var positioning = "absolute".equals(text(node, "positioning"))
            ? SafeAreaInsets.Positioning.ABSOLUTE
            : SafeAreaInsets.Positioning.SAFE_AREA;
        var value = number(node, "value");
        return new SafeAreaInsets.Inset(positioning, value == null ? 0 : value);
    }

    private static List<LayoutNode> parseChildren(JsonNode node) {
        var children = new ArrayList<LayoutNode>();
        if (node != null && node.isArray()) {
            for (var child : node) {
                var parsed = parseNode(child);
                if (parsed != null) {
                    children.add(parsed);
                }
            }
        }
        return children;
    }

    private static Map<String, JsonValue> parseValues(JsonNode node) {
        var values = new LinkedHashMap<String, JsonValue>();
        forEachField(node, (key, value) -> values.put(key, JsonValues.fromNode(value)));
        return values;
    }

    private static void forEachField(JsonNode node, BiConsumer<String, JsonNode> consumer) {
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(entry -> consumer.accept(entry.getKey(), entry.getValue()));
        }
    }

    private static ShadowSpec parseShadow(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new ShadowSpec(text(node, "color"), number(node, "radius"), number(node, "x"), number(node, "y"));
    }

    static String text(JsonNode node, String field) {
        if (node == null) return null;
        var value = node.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    static Double number(JsonNode node, String field) {
        if (node == null) return null;
        var value = node.get(field);
        return value != null && value.isNumber() ? value.doubleValue() : null;
    }

    private static boolean bool(JsonNode node, String field) {
        var value = optionalBool(node, field);
        return value != null && value;
    }

    private static Boolean optionalBool(JsonNode node, String field) {
        if (node == null) return null;
        var value = node.get(field);
        return value != null && value.isBoolean() ? value.booleanValue() : null;
    }
}

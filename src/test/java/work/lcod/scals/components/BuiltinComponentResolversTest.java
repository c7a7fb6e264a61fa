package work.lcod.scals.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.scals.ir.ButtonNode;
import work.lcod.scals.ir.Color;
import work.lcod.scals.ir.DividerNode;
import work.lcod.scals.ir.GradientNode;
import work.lcod.scals.ir.ImageNode;
import work.lcod.scals.ir.ImageSource;
import work.lcod.scals.ir.PageIndicatorNode;
import work.lcod.scals.ir.ShapeNode;
import work.lcod.scals.ir.SliderNode;
import work.lcod.scals.ir.TextFieldNode;
import work.lcod.scals.ir.UnitPoint;
import work.lcod.scals.resolution.ResolutionResult;
import work.lcod.scals.resolution.Resolver;
import work.lcod.scals.state.StateStore;
import work.lcod.scals.support.ScalsTestSupport;

class BuiltinComponentResolversTest {

    private static ResolutionResult resolve(String state, String styles, String children) {
        var document = ScalsTestSupport.document("{\"id\":\"components\",\"state\":" + state
            + ",\"styles\":" + styles + ",\"root\":{\"children\":[" + children + "]}}");
        var store = new StateStore();
        store.initialize(document.state());
        return new Resolver().resolve(document, store);
    }

    private static ResolutionResult resolve(String state, String children) {
        return resolve(state, "{}", children);
    }

    @Test
    void buttonResolvesOneStylePerState() {
        var result = resolve("{\"tab\":true}",
            "{\"base\":{\"textColor\":\"#000000\",\"fontSize\":15},"
                + "\"active\":{\"inherits\":\"base\",\"textColor\":\"#FF0000\"}}",
            "{\"type\":\"button\",\"id\":\"tab\",\"text\":\"Home\",\"isSelectedBinding\":\"tab\","
                + "\"styles\":{\"normal\":\"base\",\"selected\":\"active\"},\"buttonShape\":\"capsule\"}");
        var button = ScalsTestSupport.require(result.tree(), "tab", ButtonNode.class);

        assertEquals("Home", button.label());
        assertEquals("base", button.styleId());
        assertTrue(button.selected());
        assertEquals(Color.BLACK, button.styles().normal().textStyle().textColor());
        assertEquals(new Color(1, 0, 0, 1), button.styles().selected().textStyle().textColor());
        assertEquals(15, button.styles().selected().textStyle().fontSize());
        assertNull(button.styles().disabled());
        assertEquals(button.styles().selected(), button.styles().style(true, false));
        assertEquals(button.styles().normal(), button.styles().style(false, true));
        assertEquals(ButtonNode.ButtonShape.CAPSULE, button.buttonShape());
        assertEquals(ButtonNode.ImagePlacement.LEADING, button.imagePlacement());
        assertEquals(8, button.imageSpacing());
    }

    @Test
    void buttonIsNotSelectedWhenBindingIsFalsy() {
        var result = resolve("{\"tab\":\"yes\"}",
            "{\"type\":\"button\",\"id\":\"b\",\"text\":\"x\",\"isSelectedBinding\":\"tab\","
                + "\"image\":{\"sfsymbol\":\"house\"},\"imagePlacement\":\"top\",\"imageSpacing\":4}");
        var button = ScalsTestSupport.require(result.tree(), "b", ButtonNode.class);

        assertFalse(button.selected());
        assertEquals(ImageSource.sfSymbol("house"), button.image());
        assertEquals(ButtonNode.ImagePlacement.TOP, button.imagePlacement());
        assertEquals(4, button.imageSpacing());
    }

    @Test
    void textFieldShowsBoundValue() {
        var result = resolve("{\"form\":{\"name\":\"Ada\"}}",
            "{\"type\":\"textfield\",\"id\":\"name\",\"placeholder\":\"Your name\",\"bind\":\"form.name\"},"
                + "{\"type\":\"textfield\",\"id\":\"unbound\"}");
        var bound = ScalsTestSupport.require(result.tree(), "name", TextFieldNode.class);
        var unbound = ScalsTestSupport.require(result.tree(), "unbound", TextFieldNode.class);

        assertEquals("Ada", bound.value());
        assertEquals("form.name", bound.bindingPath());
        assertEquals("Your name", bound.placeholder());
        assertEquals("", unbound.value());
        assertEquals("", unbound.placeholder());
        assertNull(unbound.bindingPath());
    }

    @Test
    void sliderClampsToItsRange() {
        var result = resolve("{\"volume\":42,\"low\":-3}",
            "{\"type\":\"slider\",\"id\":\"volume\",\"bind\":\"volume\",\"minValue\":0,\"maxValue\":10},"
                + "{\"type\":\"slider\",\"id\":\"low\",\"bind\":\"low\",\"minValue\":0,\"maxValue\":10},"
                + "{\"type\":\"slider\",\"id\":\"plain\"}");
        var high = ScalsTestSupport.require(result.tree(), "volume", SliderNode.class);
        var low = ScalsTestSupport.require(result.tree(), "low", SliderNode.class);
        var plain = ScalsTestSupport.require(result.tree(), "plain", SliderNode.class);

        assertEquals(10, high.value());
        assertEquals(0, low.value());
        assertEquals(0, plain.minValue());
        assertEquals(1, plain.maxValue());
        assertEquals(0, plain.value());
        assertEquals(Color.parse("#007AFF"), plain.tintColor());
    }

    @Test
    void imageSourcesFollowTheirDeclaration() {
        var result = resolve("{\"user\":{\"id\":7},\"avatarUrl\":\"https://cdn.example.com/a.png\"}",
            "{\"type\":\"image\",\"id\":\"symbol\",\"image\":{\"system\":\"star.fill\"}},"
                + "{\"type\":\"image\",\"id\":\"asset\",\"image\":{\"asset\":\"logo\"}},"
                + "{\"type\":\"image\",\"id\":\"remote\",\"image\":{\"url\":\"https://cdn.example.com/${user.id}.png\",\"placeholder\":\"person\"}},"
                + "{\"type\":\"image\",\"id\":\"dynamic\",\"image\":{\"statePath\":\"avatarUrl\"}},"
                + "{\"type\":\"image\",\"id\":\"empty\"}");

        var symbol = ScalsTestSupport.require(result.tree(), "symbol", ImageNode.class);
        assertEquals(ImageSource.sfSymbol("star.fill"), symbol.source());
        assertNull(symbol.loading());

        assertEquals(ImageSource.asset("logo"), ScalsTestSupport.require(result.tree(), "asset", ImageNode.class).source());

        var remote = ScalsTestSupport.require(result.tree(), "remote", ImageNode.class);
        assertEquals(ImageSource.url("https://cdn.example.com/7.png"), remote.source());
        assertEquals(ImageSource.sfSymbol("person"), remote.placeholder());
        assertEquals(ImageSource.ACTIVITY_INDICATOR, remote.loading());

        var dynamic = ScalsTestSupport.require(result.tree(), "dynamic", ImageNode.class);
        assertEquals(ImageSource.statePath("avatarUrl"), dynamic.source());
        assertEquals(ImageSource.ACTIVITY_INDICATOR, dynamic.loading());

        assertEquals(ImageSource.sfSymbol("questionmark"), ScalsTestSupport.require(result.tree(), "empty", ImageNode.class).source());
    }

    @Test
    void dividerTakesColorAndThicknessFromStyle() {
        var result = resolve("{}",
            "{\"type\":\"divider\",\"id\":\"plain\"},"
                + "{\"type\":\"divider\",\"id\":\"thick\",\"style\":{\"backgroundColor\":\"#FFFFFF\",\"height\":2}}");
        var plain = ScalsTestSupport.require(result.tree(), "plain", DividerNode.class);
        var thick = ScalsTestSupport.require(result.tree(), "thick", DividerNode.class);

        assertEquals(1, plain.thickness());
        assertEquals(new Color(0.8, 0.8, 0.8, 1), plain.color());
        assertEquals(2, thick.thickness());
        assertEquals(Color.WHITE, thick.color());
    }

    @Test
    void gradientStopsAndDirection() {
        var result = resolve("{}",
            "{\"type\":\"gradient\",\"id\":\"fade\",\"gradientType\":\"linear\",\"gradientStart\":\"leading\","
                + "\"gradientEnd\":\"trailing\",\"gradientColors\":["
                + "{\"color\":\"#000000\",\"location\":0},"
                + "{\"lightColor\":\"#FFFFFF\",\"darkColor\":\"#000000\",\"location\":1}]}");
        var gradient = ScalsTestSupport.require(result.tree(), "fade", GradientNode.class);

        assertEquals(GradientNode.GradientType.LINEAR, gradient.gradientType());
        assertEquals(UnitPoint.LEADING, gradient.startPoint());
        assertEquals(UnitPoint.TRAILING, gradient.endPoint());
        assertEquals(2, gradient.colors().size());
        assertFalse(gradient.colors().get(0).color().isAdaptive());
        var adaptive = gradient.colors().get(1);
        assertTrue(adaptive.color().isAdaptive());
        assertEquals(1, adaptive.location());
        assertEquals(Color.WHITE, adaptive.color().light());
        assertEquals(Color.BLACK, adaptive.color().dark());
    }

    @Test
    void shapeKeepsCornerRadiusOnlyWhenRounded() {
        var result = resolve("{}",
            "{\"type\":\"shape\",\"id\":\"pill\",\"shapeType\":\"roundedRectangle\",\"cornerRadius\":6,"
                + "\"style\":{\"backgroundColor\":\"#FF0000\",\"borderWidth\":1,\"borderColor\":\"#000000\"}},"
                + "{\"type\":\"shape\",\"id\":\"dot\",\"shapeType\":\"circle\",\"cornerRadius\":6}");
        var pill = ScalsTestSupport.require(result.tree(), "pill", ShapeNode.class);
        var dot = ScalsTestSupport.require(result.tree(), "dot", ShapeNode.class);

        assertEquals(ShapeNode.ShapeType.ROUNDED_RECTANGLE, pill.shapeType());
        assertEquals(6, pill.cornerRadius());
        assertEquals(new Color(1, 0, 0, 1), pill.fillColor());
        assertEquals(Color.BLACK, pill.strokeColor());
        assertEquals(1, pill.strokeWidth());
        assertEquals(ShapeNode.ShapeType.CIRCLE, dot.shapeType());
        assertEquals(0, dot.cornerRadius());
        assertEquals(Color.CLEAR, dot.fillColor());
    }

    @Test
    void pageIndicatorCountsFromStateOrExpression() {
        var result = resolve("{\"page\":2,\"pages\":[1,2,3],\"total\":4}",
            "{\"type\":\"pageIndicator\",\"id\":\"fromArray\",\"currentPage\":\"page\",\"pageCount\":\"pages\"},"
                + "{\"type\":\"pageIndicator\",\"id\":\"fromExpression\",\"currentPage\":\"page\",\"pageCount\":\"${pages.count}\"},"
                + "{\"type\":\"pageIndicator\",\"id\":\"fromNumber\",\"currentPage\":\"page\",\"pageCount\":3,\"dotSize\":6},"
                + "{\"type\":\"pageIndicator\",\"id\":\"fromPath\",\"currentPage\":\"page\",\"pageCount\":\"total\"},"
                + "{\"type\":\"pageIndicator\",\"id\":\"defaulted\",\"currentPage\":\"missing\"}");

        var fromArray = ScalsTestSupport.require(result.tree(), "fromArray", PageIndicatorNode.class);
        assertEquals(2, fromArray.currentPage());
        assertEquals(3, fromArray.pageCount());
        assertEquals(8, fromArray.dotSize());
        assertEquals(3, ScalsTestSupport.require(result.tree(), "fromExpression", PageIndicatorNode.class).pageCount());
        assertEquals(6, ScalsTestSupport.require(result.tree(), "fromNumber", PageIndicatorNode.class).dotSize());
        assertEquals(4, ScalsTestSupport.require(result.tree(), "fromPath", PageIndicatorNode.class).pageCount());
        var defaulted = ScalsTestSupport.require(result.tree(), "defaulted", PageIndicatorNode.class);
        assertEquals(0, defaulted.currentPage());
        assertEquals(5, defaulted.pageCount());
    }

    @Test
    void incompleteComponentsAreReportedAndOmitted() {
        var result = resolve("{}",
            "{\"type\":\"gradient\",\"id\":\"g\"},"
                + "{\"type\":\"shape\",\"id\":\"s\"},"
                + "{\"type\":\"pageIndicator\",\"id\":\"p\",\"pageCount\":3},"
                + "{\"type\":\"divider\",\"id\":\"ok\"}");

        assertEquals(1, result.tree().root().children().size());
        assertEquals(
            List.of("root.children[0]", "root.children[1]", "root.children[2]"),
            result.errors().stream().map(error -> error.documentPath()).toList()
        );
        assertTrue(result.errors().stream().allMatch(error -> "missing_field".equals(error.code())));
    }
}

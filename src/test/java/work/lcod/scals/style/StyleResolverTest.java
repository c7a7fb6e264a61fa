package work.lcod.scals.style;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.scals.document.Padding;
import work.lcod.scals.document.ShadowSpec;
import work.lcod.scals.document.Style;
import work.lcod.scals.ir.Color;
import work.lcod.scals.ir.EdgeInsets;

class StyleResolverTest {
    private static final ShadowSpec CLEAR_SHADOW = new ShadowSpec(null, null, null, null);

    @Test
    void childOverridesParentPropertyByProperty() {
        var resolver = new StyleResolver(Map.of(
            "base", Style.builder().fontSize(14.0).textColor("#000000").build(),
            "title", Style.builder().inherits("base").fontSize(24.0).build()
        ));
        var resolved = resolver.resolve("title");
        assertEquals(24.0, resolved.fontSize());
        assertEquals(Color.BLACK, resolved.textColor());
    }

    @Test
    void clearedShadowStaysAbsentUntilReSet() {
        var a = Style.builder().shadow(new ShadowSpec("#000000", 4.0, 0.0, 2.0)).build();
        var b = Style.builder().inherits("a").shadow(CLEAR_SHADOW).build();
        var silent = Style.builder().inherits("b").fontSize(12.0).build();
        var reSet = Style.builder().inherits("b").shadow(new ShadowSpec("#FF0000", 8.0, null, null)).build();
        var resolver = new StyleResolver(Map.of("a", a, "b", b, "silent", silent, "reSet", reSet));

        assertTrue(resolver.resolve("a").hasShadow());
        assertNull(resolver.resolve("b").shadow());
        assertNull(resolver.resolve("silent").shadow());

        var shadow = resolver.resolve("reSet").shadow();
        assertEquals(Color.parse("#FF0000"), shadow.color());
        assertEquals(8.0, shadow.radius());
        assertEquals(0.0, shadow.x());
        assertEquals(0.0, shadow.y());
    }

    @Test
    void clearingShadowKeepsOtherProperties() {
        var resolver = new StyleResolver(Map.of(
            "card", Style.builder()
                .backgroundColor("#FFFFFF")
                .cornerRadius(12.0)
                .shadow(new ShadowSpec("#000000", 8.0, 0.0, 4.0))
                .padding(Padding.uniform(16))
                .build(),
            "flatCard", Style.builder().inherits("card").shadow(CLEAR_SHADOW).build()
        ));
        var flat = resolver.resolve("flatCard");
        assertFalse(flat.hasShadow());
        assertEquals(Color.WHITE, flat.backgroundColor());
        assertEquals(12.0, flat.cornerRadius());
        assertEquals(EdgeInsets.all(16), flat.padding());
    }

    @Test
    void clearedPaddingResetsEveryEdge() {
        var resolver = new StyleResolver(Map.of(
            "padded", Style.builder().padding(Padding.uniform(10)).build(),
            "bare", Style.builder().inherits("padded").padding(Padding.CLEAR).build()
        ));
        assertFalse(resolver.resolve("bare").hasPadding());
        assertEquals(EdgeInsets.ZERO, resolver.resolve("bare").padding());
    }

    @Test
    void paddingShorthandsExpandToEdges() {
        var shorthand = new Padding(null, null, null, null, 16.0, 12.0, null);
        var explicit = new Padding(12.0, 12.0, 16.0, 16.0, null, null, null);
        assertEquals(explicit.toEdgeInsets(), shorthand.toEdgeInsets());

        var mixed = new Padding(4.0, null, null, null, 16.0, 12.0, 2.0);
        assertEquals(new EdgeInsets(4, 12, 16, 16), mixed.toEdgeInsets());
    }

    @Test
    void descendantEdgesLayerOverAncestorEdges() {
        var resolver = new StyleResolver(Map.of(
            "base", Style.builder().padding(Padding.uniform(8)).build(),
            "top", Style.builder().inherits("base").padding(new Padding(20.0, null, null, null, null, null, null)).build()
        ));
        assertEquals(new EdgeInsets(20, 8, 8, 8), resolver.resolve("top").padding());
    }

    @Test
    void nodePaddingOverridesStyleEdgeByEdge() {
        var resolved = ResolvedStyle.of(Style.builder().padding(Padding.uniform(8)).build());
        var node = new Padding(null, null, 2.0, null, null, null, null);
        assertEquals(new EdgeInsets(8, 8, 2, 8), resolved.paddingWith(node));
    }

    @Test
    void inlineStyleMergesLast() {
        var resolver = new StyleResolver(Map.of("base", Style.builder().fontSize(14.0).build()));
        var resolved = resolver.resolve("base", Style.builder().fontSize(18.0).textColor("#FFFFFF").build());
        assertEquals(18.0, resolved.fontSize());
        assertEquals(Color.WHITE, resolved.textColor());
    }

    @Test
    void shadowDefaultsMissingSubFields() {
        var resolved = ResolvedStyle.of(Style.builder().shadow(new ShadowSpec(null, 6.0, null, null)).build());
        var shadow = resolved.shadow();
        assertEquals(new Color(0, 0, 0, 0.33), shadow.color());
        assertEquals(6.0, shadow.radius());
    }

    @Test
    void cyclicInheritanceIsReported() {
        var resolver = new StyleResolver(Map.of(
            "a", Style.builder().inherits("b").build(),
            "b", Style.builder().inherits("a").build()
        ));
        var error = assertThrows(StyleCycleException.class, () -> resolver.resolve("a"));
        assertEquals("style_cycle", error.code());
        assertEquals(List.of("a", "b", "a"), error.chain());
    }

    @Test
    void unknownStyleResolvesEmpty() {
        var resolved = new StyleResolver(Map.of()).resolve("missing");
        assertNull(resolved.fontSize());
        assertFalse(resolved.hasShadow());
    }

    @Test
    void designSystemStylesAreLookedUpByReference() {
        DesignSystemProvider provider = reference -> "button.primary".equals(reference)
            ? Optional.of(Style.builder().backgroundColor("#007AFF").build())
            : Optional.empty();
        var resolver = new StyleResolver(
            Map.of("cta", Style.builder().inherits("@button.primary").cornerRadius(8.0).build()),
            provider
        );
        var resolved = resolver.resolve("cta");
        assertEquals(Color.parse("#007AFF"), resolved.backgroundColor());
        assertEquals(8.0, resolved.cornerRadius());
    }
}

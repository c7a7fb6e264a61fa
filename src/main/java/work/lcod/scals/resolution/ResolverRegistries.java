package work.lcod.scals.resolution;

import work.lcod.scals.components.BuiltinComponentResolvers;
import work.lcod.scals.sections.BuiltinSectionLayoutConfigResolvers;

/**
 * The three kind-keyed registries a {@link Resolver} dispatches through. Each engine owns its own
 * set; nothing is global.
 */
public record ResolverRegistries(
    LayoutResolverRegistry layouts,
    ComponentResolverRegistry components,
    SectionLayoutConfigResolverRegistry sectionLayouts
) {
    public static ResolverRegistries empty() {
        return new ResolverRegistries(
            new LayoutResolverRegistry(),
            new ComponentResolverRegistry(),
            new SectionLayoutConfigResolverRegistry()
        );
    }

    /** Registries holding every built-in layout, component and section arrangement. */
    public static ResolverRegistries defaults() {
        var registries = empty();
        BuiltinLayoutResolvers.register(registries.layouts());
        BuiltinComponentResolvers.register(registries.components());
        BuiltinSectionLayoutConfigResolvers.register(registries.sectionLayouts());
        return registries;
    }
}

package work.lcod.scals.resolution;

import work.lcod.scals.document.SectionLayout;

@FunctionalInterface
public interface SectionLayoutConfigResolver {
    ResolvedSectionLayout resolve(SectionLayout.Config config, ResolutionContext context);
}

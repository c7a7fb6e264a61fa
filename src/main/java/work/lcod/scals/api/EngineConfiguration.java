package work.lcod.scals.api;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import work.lcod.scals.resolution.Resolver;
import work.lcod.scals.style.DesignSystemProvider;

/**
 * Immutable engine settings.
 *
 * @param trackingEnabled record dependencies and re-resolve incrementally on state changes
 * @param allowUnknownComponents accept unregistered component kinds at validation, with a warning
 * @param allowUnknownActions accept unregistered action kinds at validation, with a warning
 * @param defaultSectionItemSpacing item spacing for sections that do not set one
 * @param resolutionExecutor host executor behind the serial resolution context
 * @param designSystem source of {@code @}-prefixed styles
 */
public record EngineConfiguration(
    boolean trackingEnabled,
    boolean allowUnknownComponents,
    boolean allowUnknownActions,
    double defaultSectionItemSpacing,
    Executor resolutionExecutor,
    Optional<DesignSystemProvider> designSystem
) {
    public EngineConfiguration {
        Objects.requireNonNull(resolutionExecutor, "resolutionExecutor");
        Objects.requireNonNull(designSystem, "designSystem");
        if (defaultSectionItemSpacing < 0) {
            throw new IllegalArgumentException("defaultSectionItemSpacing must not be negative");
        }
    }

    public static EngineConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .trackingEnabled(trackingEnabled)
            .allowUnknownComponents(allowUnknownComponents)
            .allowUnknownActions(allowUnknownActions)
            .defaultSectionItemSpacing(defaultSectionItemSpacing)
            .resolutionExecutor(resolutionExecutor)
            .designSystem(designSystem.orElse(null));
    }

    public static final class Builder {
        private boolean trackingEnabled = true;
        private boolean allowUnknownComponents = true;
        private boolean allowUnknownActions = true;
        private double defaultSectionItemSpacing = Resolver.DEFAULT_SECTION_ITEM_SPACING;
        private Executor resolutionExecutor = Runnable::run;
        private DesignSystemProvider designSystem;

        public Builder trackingEnabled(boolean trackingEnabled) {
            this.trackingEnabled = trackingEnabled;
            return this;
        }

        public Builder allowUnknownComponents(boolean allowUnknownComponents) {
            this.allowUnknownComponents = allowUnknownComponents;
            return this;
        }

        public Builder allowUnknownActions(boolean allowUnknownActions) {
            this.allowUnknownActions = allowUnknownActions;
            return this;
        }

        public Builder defaultSectionItemSpacing(double defaultSectionItemSpacing) {
            this.defaultSectionItemSpacing = defaultSectionItemSpacing;
            return this;
        }

        public Builder resolutionExecutor(Executor resolutionExecutor) {
            this.resolutionExecutor = resolutionExecutor;
            return this;
        }

        public Builder designSystem(DesignSystemProvider designSystem) {
            this.designSystem = designSystem;
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(
                trackingEnabled,
                allowUnknownComponents,
                allowUnknownActions,
                defaultSectionItemSpacing,
                resolutionExecutor,
                Optional.ofNullable(designSystem)
            );
        }
    }
}

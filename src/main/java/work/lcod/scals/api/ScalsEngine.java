package work.lcod.scals.api;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import work.lcod.scals.action.ActionDelegate;
import work.lcod.scals.action.ActionPresenter;
import work.lcod.scals.action.ActionRegistry;
import work.lcod.scals.action.ActionResolver;
import work.lcod.scals.document.DocumentDefinition;
import work.lcod.scals.document.DocumentLoader;
import work.lcod.scals.document.DocumentValidator;
import work.lcod.scals.ir.RenderTree;
import work.lcod.scals.resolution.Resolver;
import work.lcod.scals.resolution.ResolverRegistries;
import work.lcod.scals.state.StateStore;

/**
 * Public entry point for embedding the engine: loads documents and opens sessions on them.
 *
 * <p>The registries are live objects. Kinds registered on them after the engine is built are
 * picked up by later loads and sessions.
 */
public final class ScalsEngine {
    private final EngineConfiguration configuration;
    private final ResolverRegistries registries;
    private final ActionResolver actionResolver;
    private final ActionRegistry actionRegistry;
    private final ActionDelegate delegate;
    private final ActionPresenter presenter;
    private final Resolver resolver;

    private ScalsEngine(Builder builder) {
        this.configuration = builder.configuration;
        this.registries = builder.registries;
        this.actionResolver = builder.actionResolver;
        this.actionRegistry = builder.actionRegistry;
        this.delegate = builder.delegate;
        this.presenter = builder.presenter;
        this.resolver = new Resolver(
            registries,
            actionResolver,
            configuration.designSystem().orElse(null),
            configuration.trackingEnabled(),
            configuration.defaultSectionItemSpacing()
        );
    }

    public static ScalsEngine create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public EngineConfiguration configuration() {
        return configuration;
    }

    public ResolverRegistries registries() {
        return registries;
    }

    public ActionResolver actionResolver() {
        return actionResolver;
    }

    public ActionRegistry actionRegistry() {
        return actionRegistry;
    }

    public Resolver resolver() {
        return resolver;
    }

    public DocumentDefinition loadJson(String json) {
        return loader().loadJson(json);
    }

    public DocumentDefinition loadYaml(String yaml) {
        return loader().loadYaml(yaml);
    }

    public DocumentDefinition load(Path path) {
        return loader().load(path);
    }

    /** Initializes a fresh store from the document's state and resolves it once. */
    public DocumentSession open(DocumentDefinition document) {
        return new DocumentSession(this, document, new StateStore());
    }

    /**
     * Resolves against an existing store, e.g. one restored from a snapshot. An empty store is
     * initialized from the document first.
     */
    public DocumentSession open(DocumentDefinition document, StateStore store) {
        return new DocumentSession(this, document, store);
    }

    /** One-shot resolution without a session. The store is used as is. */
    public RenderTree resolve(DocumentDefinition document, StateStore store) {
        return resolver.resolve(document, store).tree();
    }

    ActionDelegate delegate() {
        return delegate;
    }

    ActionPresenter presenter() {
        return presenter;
    }

    private DocumentLoader loader() {
        var components = new HashSet<>(DocumentValidator.BUILT_IN_COMPONENTS);
        components.addAll(registries.components().entries().keySet());
        var actions = new HashSet<>(DocumentValidator.BUILT_IN_ACTIONS);
        actions.addAll(actionRegistry.handlers().keySet());
        return new DocumentLoader(new DocumentValidator(
            components,
            actions,
            configuration.allowUnknownComponents(),
            configuration.allowUnknownActions()
        ));
    }

    public static final class Builder {
        private EngineConfiguration configuration = EngineConfiguration.defaults();
        private ResolverRegistries registries;
        private ActionResolver actionResolver;
        private ActionRegistry actionRegistry;
        private ActionDelegate delegate;
        private ActionPresenter presenter;

        public Builder configuration(EngineConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder registries(ResolverRegistries registries) {
            this.registries = registries;
            return this;
        }

        public Builder actionResolver(ActionResolver actionResolver) {
            this.actionResolver = actionResolver;
            return this;
        }

        public Builder actionRegistry(ActionRegistry actionRegistry) {
            this.actionRegistry = actionRegistry;
            return this;
        }

        public Builder delegate(ActionDelegate delegate) {
            this.delegate = delegate;
            return this;
        }

        public Builder presenter(ActionPresenter presenter) {
            this.presenter = presenter;
            return this;
        }

        public ScalsEngine build() {
            Objects.requireNonNull(configuration, "configuration");
            if (registries == null) {
                registries = ResolverRegistries.defaults();
            }
            if (actionResolver == null) {
                actionResolver = ActionResolver.defaults();
            }
            if (actionRegistry == null) {
                actionRegistry = ActionRegistry.defaults();
            }
            return new ScalsEngine(this);
        }
    }
}

package work.lcod.scals.action;

import java.util.Objects;

/**
 * Resolved action: a kind tag plus its typed parameters.
 */
public record ActionDefinition(ActionKind kind, ActionParameters parameters) {
    public ActionDefinition {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(parameters, "parameters");
    }

    /**
     * Typed view of the parameters.
     *
     * @throws ActionResolutionException when the parameters are of another kind
     */
    public <T extends ActionParameters> T parameters(Class<T> type) {
        if (!type.isInstance(parameters)) {
            throw new ActionResolutionException(kind.name(),
                "expected " + type.getSimpleName() + " parameters, got " + parameters.getClass().getSimpleName());
        }
        return type.cast(parameters);
    }
}

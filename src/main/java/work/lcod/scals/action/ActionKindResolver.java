package work.lcod.scals.action;

import work.lcod.scals.document.DocumentAction;

/**
 * Turns the loose parameters of one action kind into its typed {@link ActionDefinition}.
 */
@FunctionalInterface
public interface ActionKindResolver {
    ActionDefinition resolve(DocumentAction action);
}

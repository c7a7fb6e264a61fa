package work.lcod.scals.ir;

import work.lcod.scals.action.ActionDefinition;

/**
 * Action attached to a node: the id of a document action or an inline definition.
 */
public record ActionRef(String actionId, ActionDefinition inline) {
    public static ActionRef to(String actionId) {
        return new ActionRef(actionId, null);
    }

    public static ActionRef of(ActionDefinition inline) {
        return new ActionRef(null, inline);
    }
}

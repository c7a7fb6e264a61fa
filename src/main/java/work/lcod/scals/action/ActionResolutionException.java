package work.lcod.scals.action;

import work.lcod.scals.shared.ScalsException;

/**
 * An action's parameters are missing or of the wrong type.
 */
public final class ActionResolutionException extends ScalsException {
    private final String actionType;

    public ActionResolutionException(String actionType, String message) {
        super("invalid_action", "Action '" + actionType + "': " + message);
        this.actionType = actionType;
    }

    public String actionType() {
        return actionType;
    }
}

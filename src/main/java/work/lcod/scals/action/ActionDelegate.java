package work.lcod.scals.action;

/**
 * Host hook for action kinds that have no registered handler.
 */
@FunctionalInterface
public interface ActionDelegate {
    /**
     * @return {@code true} when the host took care of the action
     */
    boolean handleAction(ActionDefinition definition, ActionContext context);
}

package work.lcod.scals.action;

import java.util.concurrent.CompletableFuture;

/**
 * Executes one action kind. Long-running handlers should check {@code token} and stop producing
 * effects once it is cancelled.
 */
@FunctionalInterface
public interface ActionHandler {
    CompletableFuture<Void> execute(ActionDefinition definition, ActionContext context, CancellationToken token)
        throws Exception;
}

package work.lcod.scals.resolution;

import work.lcod.scals.shared.ScalsException;

/**
 * Failure confined to one document subtree. The orchestrator records it and keeps resolving
 * the siblings.
 */
public class ResolutionException extends ScalsException {
    public ResolutionException(String code, String message) {
        super(code, message);
    }

    public ResolutionException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}

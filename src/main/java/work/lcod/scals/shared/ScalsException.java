package work.lcod.scals.shared;

/**
 * Base exception carrying a stable machine-readable code alongside the message.
 */
public class ScalsException extends RuntimeException {
    private final String code;

    public ScalsException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ScalsException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}

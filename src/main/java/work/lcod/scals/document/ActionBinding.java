package work.lcod.scals.document;

/**
 * Reference to a named document action, or an inline action. Exactly one side is set.
 */
public record ActionBinding(String reference, DocumentAction inline) {
    public static ActionBinding reference(String actionId) {
        return new ActionBinding(actionId, null);
    }

    public static ActionBinding inline(DocumentAction action) {
        return new ActionBinding(null, action);
    }

    public boolean isReference() {
        return reference != null;
    }
}

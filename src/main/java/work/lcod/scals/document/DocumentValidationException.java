package work.lcod.scals.document;

import java.util.List;
import java.util.stream.Collectors;
import work.lcod.scals.shared.ScalsException;

/**
 * Raised when a document fails validation. Carries every issue found, not only the first.
 */
public final class DocumentValidationException extends ScalsException {
    private final List<ValidationIssue> issues;

    public DocumentValidationException(List<ValidationIssue> issues) {
        super("invalid_document", describe(issues));
        this.issues = List.copyOf(issues);
    }

    public DocumentValidationException(List<ValidationIssue> issues, Throwable cause) {
        super("invalid_document", describe(issues), cause);
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    private static String describe(List<ValidationIssue> issues) {
        if (issues.size() == 1) {
            return "Invalid document: " + issues.get(0);
        }
        return "Invalid document (" + issues.size() + " issues):\n"
            + issues.stream().map(issue -> "  - " + issue).collect(Collectors.joining("\n"));
    }
}

package work.lcod.scals.document;

import java.util.List;

public record ValidationResult(List<ValidationIssue> errors, List<String> warnings) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}

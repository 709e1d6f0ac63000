package work.canopy.api;

import java.util.List;

public record ValidationReport(List<String> errors, List<String> warnings) {
    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    public String describeErrors() {
        var builder = new StringBuilder("Validation failed:");
        errors.forEach(error -> builder.append("\n  - ").append(error));
        return builder.toString();
    }
}

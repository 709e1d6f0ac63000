package work.canopy.error;

import java.util.List;
import java.util.Objects;

/**
 * Base exception carrying a structured error (kind, offending value, context path, suggestions).
 */
public abstract class CanopyException extends RuntimeException {
    private final ErrorKind kind;
    private final String offendingValue;
    private final String context;
    private final List<String> suggestions;

    protected CanopyException(ErrorKind kind, String message, String offendingValue, String context, List<String> suggestions, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.offendingValue = offendingValue;
        this.context = context;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public ErrorKind kind() {
        return kind;
    }

    public ErrorCategory category() {
        return kind.category();
    }

    public String offendingValue() {
        return offendingValue;
    }

    public String context() {
        return context;
    }

    public List<String> suggestions() {
        return suggestions;
    }
}

package work.canopy.error;

import java.util.List;

public final class EnvelopeValidationException extends CanopyException {
    private final List<String> violations;

    public EnvelopeValidationException(String target, List<String> violations) {
        super(
            ErrorKind.ENVELOPE_INVALID,
            "Envelope validation failed for " + target + ":\n  - " + String.join("\n  - ", violations),
            target,
            null,
            null,
            null
        );
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}

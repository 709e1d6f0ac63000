package work.canopy.envelope;

import java.util.Objects;
import java.util.Optional;
import work.canopy.primitive.PrimitiveOutcome;

public record BuildResult(Optional<Envelope> envelope, PrimitiveOutcome outcome) {
    public BuildResult {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(outcome, "outcome");
    }

    public boolean success() {
        return envelope.isPresent();
    }

    public String describeFailure() {
        var error = outcome.error().orElse("Primitive failed");
        return outcome.message().map(message -> error + ": " + message).orElse(error);
    }
}

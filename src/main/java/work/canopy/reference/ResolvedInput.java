package work.canopy.reference;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.canopy.envelope.Envelope;
import work.canopy.envelope.EnvelopeInput;

public record ResolvedInput(Path path, String semanticType, Optional<Envelope> envelope) {
    public ResolvedInput {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(semanticType, "semanticType");
        Objects.requireNonNull(envelope, "envelope");
    }

    public EnvelopeInput toEnvelopeInput(String name) {
        return new EnvelopeInput(name, path, semanticType, envelope);
    }
}

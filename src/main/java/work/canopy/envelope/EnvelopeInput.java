package work.canopy.envelope;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

public record EnvelopeInput(String name, Path path, String semanticType, Optional<Envelope> envelope) {
    public EnvelopeInput {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(semanticType, "semanticType");
        Objects.requireNonNull(envelope, "envelope");
    }

    public static EnvelopeInput file(String name, Path path, String semanticType) {
        return new EnvelopeInput(name, path, semanticType, Optional.empty());
    }

    public static EnvelopeInput fromEnvelope(String name, Envelope envelope) {
        return new EnvelopeInput(name, Path.of(envelope.data().path()), envelope.semanticType(), Optional.of(envelope));
    }
}

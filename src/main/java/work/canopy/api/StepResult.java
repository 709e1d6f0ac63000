package work.canopy.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.canopy.envelope.Envelope;
import work.canopy.envelope.ProvenanceEntry;
import work.canopy.error.ErrorKind;

/**
 * Outcome of one step. Successful steps carry their envelope and output paths; failed ones the stage, the error kind
 * when one is known, and a human-readable message.
 */
public record StepResult(
    String stepId,
    boolean success,
    Optional<Envelope> envelope,
    Map<String, Path> outputPaths,
    Optional<StepFailure> failure,
    Optional<ErrorKind> errorKind,
    Optional<String> message
) {
    public StepResult {
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(failure, "failure");
        Objects.requireNonNull(errorKind, "errorKind");
        Objects.requireNonNull(message, "message");
        outputPaths = Collections.unmodifiableMap(new LinkedHashMap<>(outputPaths));
    }

    public static StepResult succeeded(String stepId, String outputName, Path outputPath, Envelope envelope) {
        return new StepResult(stepId, true, Optional.of(envelope), Map.of(outputName, outputPath), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static StepResult failed(String stepId, StepFailure failure, ErrorKind kind, String message) {
        return new StepResult(stepId, false, Optional.empty(), Map.of(), Optional.of(failure), Optional.ofNullable(kind), Optional.ofNullable(message));
    }

    public StepResult withEnvelope(Envelope updated) {
        return new StepResult(stepId, success, Optional.of(updated), outputPaths, failure, errorKind, message);
    }

    public Optional<String> error() {
        return failure.map(StepFailure::label);
    }

    public Optional<Double> durationSeconds() {
        return envelope.flatMap(Envelope::latestProvenance).map(ProvenanceEntry::durationSeconds);
    }

    public int warningCount() {
        return envelope.map(env -> env.warnings().size()).orElse(0);
    }
}

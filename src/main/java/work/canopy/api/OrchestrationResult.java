package work.canopy.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.canopy.envelope.Envelope;
import work.canopy.model.Lineage;

/**
 * Outcome of an {@link Orchestrator} run (usable by the CLI and embedding apps).
 *
 * @param completedSteps ids of the steps that succeeded, in execution order
 * @param finalEnvelopes envelopes of the completed sink steps keyed by step id; on success they carry the lineage block
 */
public record OrchestrationResult(
    boolean success,
    String experimentId,
    List<String> completedSteps,
    Optional<String> failedStep,
    Map<String, StepResult> stepResults,
    Map<String, Envelope> finalEnvelopes,
    Lineage lineage,
    ValidationReport validation,
    Optional<String> error,
    Optional<Path> runLog,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public OrchestrationResult {
        Objects.requireNonNull(experimentId, "experimentId");
        Objects.requireNonNull(failedStep, "failedStep");
        Objects.requireNonNull(lineage, "lineage");
        Objects.requireNonNull(validation, "validation");
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(runLog, "runLog");
        completedSteps = List.copyOf(completedSteps);
        stepResults = Collections.unmodifiableMap(new LinkedHashMap<>(stepResults));
        finalEnvelopes = Collections.unmodifiableMap(new LinkedHashMap<>(finalEnvelopes));
    }

    public List<String> warnings() {
        return validation.warnings();
    }

    public int exitCode() {
        return success ? 0 : 1;
    }

    public OrchestrationResult withRunLog(Path path) {
        return new OrchestrationResult(
            success, experimentId, completedSteps, failedStep, stepResults, finalEnvelopes,
            lineage, validation, error, Optional.of(path), startedAt, finishedAt
        );
    }

    public Map<String, Object> toSerializableMap() {
        var serializable = new LinkedHashMap<String, Object>();
        serializable.put("status", success ? "success" : "failure");
        serializable.put("experiment", experimentId);
        serializable.put("completedSteps", completedSteps);
        serializable.put("failedStep", failedStep.orElse(null));
        serializable.put("error", error.orElse(null));
        var outputs = new LinkedHashMap<String, Object>();
        finalEnvelopes.forEach((step, envelope) -> outputs.put(step, envelope.data().path()));
        serializable.put("outputs", outputs);
        serializable.put("warnings", new ArrayList<>(validation.warnings()));
        serializable.put("runLog", runLog.map(Path::toString).orElse(null));
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }
}

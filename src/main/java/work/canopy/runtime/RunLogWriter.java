package work.canopy.runtime;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.canopy.api.OrchestrationResult;
import work.canopy.envelope.HashProfile;
import work.canopy.model.Experiment;
import work.canopy.parse.YamlDocuments;

/**
 * Persists one YAML run log per run, named {@code <experiment id>_<yyyyMMdd_HHmmss>.yml}.
 */
public final class RunLogWriter {
    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path directory;

    public RunLogWriter(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public static String runId(String experimentId, Instant startedAt) {
        return experimentId + "_" + RUN_ID_FORMAT.format(startedAt);
    }

    public Path write(Experiment experiment, Path experimentPath, HashProfile profile, List<String> planOrder, OrchestrationResult result) {
        var runId = runId(experiment.id(), result.startedAt());
        var log = toDocument(runId, experiment, experimentPath, profile, planOrder, result);
        var path = directory.resolve(runId + ".yml");
        try {
            Files.createDirectories(directory);
            YamlDocuments.mapper().writeValue(path.toFile(), log);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write run log " + path, ex);
        }
        return path;
    }

    static Map<String, Object> toDocument(
        String runId,
        Experiment experiment,
        Path experimentPath,
        HashProfile profile,
        List<String> planOrder,
        OrchestrationResult result
    ) {
        var steps = new ArrayList<Map<String, Object>>();
        int totalWarnings = 0;
        for (var stepId : planOrder) {
            var stepResult = result.stepResults().get(stepId);
            if (stepResult == null) {
                continue;
            }
            var summary = new LinkedHashMap<String, Object>();
            summary.put("id", stepId);
            summary.put("success", stepResult.success());
            summary.put("duration_seconds", stepResult.durationSeconds().orElse(null));
            summary.put("warning_count", stepResult.warningCount());
            summary.put("error", stepResult.error().orElse(null));
            summary.put("message", stepResult.message().orElse(null));
            steps.add(summary);
            totalWarnings += stepResult.warningCount();
        }

        var experimentBlock = new LinkedHashMap<String, Object>();
        experimentBlock.put("id", experiment.id());
        experimentBlock.put("name", experiment.name());
        experimentBlock.put("path", experimentPath.toString());

        var timing = new LinkedHashMap<String, Object>();
        timing.put("started", result.startedAt().toString());
        timing.put("completed", result.finishedAt().toString());

        var outcome = new LinkedHashMap<String, Object>();
        outcome.put("success", result.success());
        outcome.put("failed_step", result.failedStep().orElse(null));
        outcome.put("error", result.error().orElse(null));

        var summary = new LinkedHashMap<String, Object>();
        summary.put("total_steps", planOrder.size());
        summary.put("completed_steps", result.completedSteps().size());
        summary.put("total_warnings", totalWarnings);

        var log = new LinkedHashMap<String, Object>();
        log.put("run_id", runId);
        log.put("experiment", experimentBlock);
        log.put("city", experiment.city());
        log.put("profile", profile.wireName());
        log.put("timing", timing);
        log.put("result", outcome);
        log.put("validation_warnings", new ArrayList<>(result.warnings()));
        log.put("steps", steps);
        log.put("summary", summary);
        return log;
    }
}

package work.canopy.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.canopy.envelope.HashProfile;

/**
 * Immutable configuration of one orchestrator run. Unset directories are derived from the manifest location or the
 * project root when the run starts.
 */
public record OrchestratorConfiguration(
    Path experimentPath,
    Path projectRoot,
    HashProfile profile,
    Optional<Path> outputDirectory,
    Optional<Path> envelopeDirectory,
    Optional<Path> runLogDirectory,
    Optional<Duration> primitiveTimeout,
    int maxParallelSteps,
    boolean verifyPrimitiveFiles,
    List<String> interpreter
) {
    public static final String DATA_DIRECTORY = ".data";
    public static final String ENVELOPE_DIRECTORY = ".envelopes";
    public static final String RUN_LOG_DIRECTORY = "compost/logs";
    public static final List<String> DEFAULT_INTERPRETER = List.of("Rscript");

    public OrchestratorConfiguration {
        Objects.requireNonNull(experimentPath, "experimentPath");
        Objects.requireNonNull(projectRoot, "projectRoot");
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(envelopeDirectory, "envelopeDirectory");
        Objects.requireNonNull(runLogDirectory, "runLogDirectory");
        Objects.requireNonNull(primitiveTimeout, "primitiveTimeout");
        if (maxParallelSteps < 1) {
            throw new IllegalArgumentException("maxParallelSteps must be at least 1, got " + maxParallelSteps);
        }
        interpreter = List.copyOf(interpreter);
    }

    public Path outputDirectoryFor(Path manifestDirectory) {
        return outputDirectory.orElse(manifestDirectory.resolve(DATA_DIRECTORY));
    }

    public Path envelopeDirectoryFor(Path manifestDirectory) {
        return envelopeDirectory.orElse(manifestDirectory.resolve(ENVELOPE_DIRECTORY));
    }

    public Path resolvedRunLogDirectory() {
        return runLogDirectory.orElse(projectRoot.resolve(RUN_LOG_DIRECTORY));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path experimentPath;
        private Path projectRoot = Path.of("").toAbsolutePath();
        private HashProfile profile = HashProfile.FULL;
        private Optional<Path> outputDirectory = Optional.empty();
        private Optional<Path> envelopeDirectory = Optional.empty();
        private Optional<Path> runLogDirectory = Optional.empty();
        private Optional<Duration> primitiveTimeout = Optional.empty();
        private int maxParallelSteps = 1;
        private boolean verifyPrimitiveFiles = true;
        private List<String> interpreter = DEFAULT_INTERPRETER;

        public Builder experimentPath(Path experimentPath) {
            this.experimentPath = experimentPath;
            return this;
        }

        public Builder projectRoot(Path projectRoot) {
            this.projectRoot = projectRoot;
            return this;
        }

        public Builder profile(HashProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = Optional.ofNullable(outputDirectory);
            return this;
        }

        public Builder envelopeDirectory(Path envelopeDirectory) {
            this.envelopeDirectory = Optional.ofNullable(envelopeDirectory);
            return this;
        }

        public Builder runLogDirectory(Path runLogDirectory) {
            this.runLogDirectory = Optional.ofNullable(runLogDirectory);
            return this;
        }

        public Builder primitiveTimeout(Optional<Duration> primitiveTimeout) {
            this.primitiveTimeout = primitiveTimeout;
            return this;
        }

        public Builder maxParallelSteps(int maxParallelSteps) {
            this.maxParallelSteps = maxParallelSteps;
            return this;
        }

        public Builder verifyPrimitiveFiles(boolean verifyPrimitiveFiles) {
            this.verifyPrimitiveFiles = verifyPrimitiveFiles;
            return this;
        }

        public Builder interpreter(List<String> interpreter) {
            this.interpreter = interpreter;
            return this;
        }

        public OrchestratorConfiguration build() {
            return new OrchestratorConfiguration(
                experimentPath,
                projectRoot,
                profile,
                outputDirectory,
                envelopeDirectory,
                runLogDirectory,
                primitiveTimeout,
                maxParallelSteps,
                verifyPrimitiveFiles,
                interpreter
            );
        }
    }
}

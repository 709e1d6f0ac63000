package work.canopy.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.canopy.envelope.Envelope;
import work.canopy.envelope.EnvelopeBuilder;
import work.canopy.envelope.EnvelopeCodec;
import work.canopy.envelope.EnvelopeSchema;
import work.canopy.envelope.Hasher;
import work.canopy.error.CanopyException;
import work.canopy.model.Experiment;
import work.canopy.model.Manifest;
import work.canopy.parse.ExperimentParser;
import work.canopy.parse.ManifestParser;
import work.canopy.plan.DependencyResolver;
import work.canopy.plan.ExecutionPlan;
import work.canopy.primitive.PrimitiveExecutor;
import work.canopy.primitive.ProcessPrimitiveExecutor;
import work.canopy.reference.ReferenceResolver;
import work.canopy.registry.RegistryCache;
import work.canopy.registry.RegistryManager;
import work.canopy.runtime.ExperimentValidator;
import work.canopy.runtime.RunLogWriter;
import work.canopy.runtime.StepRunner;
import work.canopy.runtime.StepScheduler;
import work.canopy.types.SemanticTypeRegistry;

/**
 * Public entry point: validates an experiment, plans it and runs its steps. One run per instance.
 *
 * <p>{@link #run()} never throws for step-level problems; they are reported in the {@link OrchestrationResult}, and a
 * run log is written whether the run succeeds or not. Documents that cannot be parsed fail construction.
 */
public final class Orchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(Orchestrator.class);

    private final OrchestratorConfiguration configuration;
    private final PrimitiveExecutor executor;
    private final Clock clock;
    private final Experiment experiment;
    private final Manifest manifest;
    private final Path manifestDirectory;
    private final RegistryManager registry;
    private final SemanticTypeRegistry semanticTypes;
    private final EnvelopeCodec codec;

    public Orchestrator(OrchestratorConfiguration configuration) {
        this(configuration, new ProcessPrimitiveExecutor(
            configuration.interpreter(),
            configuration.projectRoot(),
            configuration.primitiveTimeout()
        ));
    }

    public Orchestrator(OrchestratorConfiguration configuration, PrimitiveExecutor executor) {
        this(configuration, executor, Clock.systemUTC());
    }

    public Orchestrator(OrchestratorConfiguration configuration, PrimitiveExecutor executor, Clock clock) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        var root = configuration.projectRoot();
        this.experiment = ExperimentParser.load(configuration.experimentPath());
        var manifestPath = root.resolve(experiment.manifestPath()).normalize();
        this.manifest = ManifestParser.load(manifestPath);
        this.manifestDirectory = manifest.dataDirectory();
        this.registry = new RegistryManager(new RegistryCache(root));
        this.semanticTypes = SemanticTypeRegistry.load(root.resolve(SemanticTypeRegistry.DEFAULT_LOCATION));
        this.codec = new EnvelopeCodec(EnvelopeSchema.forProject(root));
    }

    public OrchestratorConfiguration configuration() {
        return configuration;
    }

    public Experiment experiment() {
        return experiment;
    }

    public Manifest manifest() {
        return manifest;
    }

    public Path outputDirectory() {
        return configuration.outputDirectoryFor(manifestDirectory);
    }

    public Path envelopeDirectory() {
        return configuration.envelopeDirectoryFor(manifestDirectory);
    }

    public ValidationReport validate() {
        return new ExperimentValidator(
            experiment,
            manifest,
            registry,
            semanticTypes,
            configuration.projectRoot(),
            configuration.verifyPrimitiveFiles()
        ).validate();
    }

    public ExecutionPlan plan() {
        return new DependencyResolver(experiment).createExecutionPlan();
    }

    public String visualize() {
        return new DependencyResolver(experiment).visualize();
    }

    public OrchestrationResult run() {
        var startedAt = Instant.now(clock);
        LOG.info("Running experiment '{}' ({} steps, profile {})", experiment.id(), experiment.steps().size(), configuration.profile().wireName());

        var validation = validate();
        if (!validation.valid()) {
            LOG.warn("Experiment '{}' failed validation with {} error(s)", experiment.id(), validation.errors().size());
            var result = finish(false, List.of(), Optional.empty(), Map.of(), Map.of(), validation,
                Optional.of(validation.describeErrors()), startedAt);
            return persist(result, experiment.stepIds());
        }

        var plan = plan();
        try {
            Files.createDirectories(outputDirectory());
            Files.createDirectories(envelopeDirectory());
        } catch (IOException ex) {
            var result = finish(false, List.of(), Optional.empty(), Map.of(), Map.of(), validation,
                Optional.of("Could not create output directories: " + ex.getMessage()), startedAt);
            return persist(result, plan.stepsInOrder());
        }

        var references = new ReferenceResolver(manifest, experiment);
        var runner = new StepRunner(
            registry,
            references,
            semanticTypes,
            new EnvelopeBuilder(new Hasher(configuration.profile()), executor, clock),
            codec,
            outputDirectory(),
            envelopeDirectory(),
            configuration.verifyPrimitiveFiles()
        );
        var outcome = new StepScheduler(plan, experiment, runner::run, configuration.maxParallelSteps()).run();

        var stepResults = new LinkedHashMap<>(outcome.results());
        var completed = new ArrayList<>(outcome.completedSteps());
        var finalEnvelopes = new LinkedHashMap<String, Envelope>();
        var failedStep = outcome.failedStep();
        var error = failedStep.map(step -> describe(stepResults.get(step)));
        var enrich = failedStep.isEmpty();

        for (var sink : plan.sinks()) {
            var stepResult = stepResults.get(sink);
            if (stepResult == null || stepResult.envelope().isEmpty()) {
                continue;
            }
            var envelope = stepResult.envelope().get();
            if (enrich) {
                envelope = envelope.withLineage(experiment.lineage().toMetadata(experiment.parameters()));
                var outputName = stepResult.outputPaths().keySet().iterator().next();
                var envelopePath = StepRunner.envelopePath(envelopeDirectory(), sink, outputName);
                try {
                    codec.write(envelope, envelopePath);
                } catch (CanopyException | UncheckedIOException ex) {
                    LOG.warn("Could not rewrite envelope of sink step '{}'", sink, ex);
                    discard(envelopePath);
                    // own output name only; a passthrough sink's data path is its input
                    discard(StepRunner.outputPath(outputDirectory(), sink, outputName, envelope.data().format()));
                    var message = ex.getMessage();
                    stepResults.put(sink, StepResult.failed(sink, StepFailure.ENVELOPE_WRITE,
                        ex instanceof CanopyException canopy ? canopy.kind() : null, message));
                    completed.remove(sink);
                    if (failedStep.isEmpty()) {
                        failedStep = Optional.of(sink);
                        error = Optional.of(StepFailure.ENVELOPE_WRITE.label() + ": " + message);
                    }
                    continue;
                }
                stepResults.put(sink, stepResult.withEnvelope(envelope));
            }
            finalEnvelopes.put(sink, envelope);
        }

        var result = finish(failedStep.isEmpty(), completed, failedStep, stepResults, finalEnvelopes, validation, error, startedAt);
        LOG.info("Experiment '{}' {} ({}/{} steps completed)", experiment.id(), result.success() ? "succeeded" : "failed",
            result.completedSteps().size(), plan.stepsInOrder().size());
        return persist(result, plan.stepsInOrder());
    }

    private OrchestrationResult finish(
        boolean success,
        List<String> completed,
        Optional<String> failedStep,
        Map<String, StepResult> stepResults,
        Map<String, Envelope> finalEnvelopes,
        ValidationReport validation,
        Optional<String> error,
        Instant startedAt
    ) {
        return new OrchestrationResult(
            success,
            experiment.id(),
            completed,
            failedStep,
            stepResults,
            finalEnvelopes,
            experiment.lineage(),
            validation,
            error,
            Optional.empty(),
            startedAt,
            Instant.now(clock)
        );
    }

    private OrchestrationResult persist(OrchestrationResult result, List<String> planOrder) {
        try {
            var path = new RunLogWriter(configuration.resolvedRunLogDirectory())
                .write(experiment, configuration.experimentPath(), configuration.profile(), planOrder, result);
            LOG.info("Run log written to {}", path);
            return result.withRunLog(path);
        } catch (UncheckedIOException ex) {
            LOG.error("Could not write run log for experiment '{}'", experiment.id(), ex);
            return result;
        }
    }

    private static void discard(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                LOG.debug("Removed {}", path);
            }
        } catch (IOException ex) {
            LOG.warn("Could not remove {}", path, ex);
        }
    }

    private static String describe(StepResult result) {
        var label = result.error().orElse("Step failed");
        return result.message().map(message -> label + ": " + message).orElse(label);
    }
}

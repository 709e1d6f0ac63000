package work.canopy.runtime;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.canopy.api.StepFailure;
import work.canopy.api.StepResult;
import work.canopy.envelope.BuildRequest;
import work.canopy.envelope.Envelope;
import work.canopy.envelope.EnvelopeBuilder;
import work.canopy.envelope.EnvelopeCodec;
import work.canopy.envelope.EnvelopeInput;
import work.canopy.error.CanopyException;
import work.canopy.error.ErrorKind;
import work.canopy.model.StepDefinition;
import work.canopy.reference.ReferenceResolver;
import work.canopy.reference.ResolvedInput;
import work.canopy.registry.RegistryManager;
import work.canopy.registry.ResolvedPrimitive;
import work.canopy.types.SemanticType;
import work.canopy.types.SemanticTypeRegistry;

/**
 * Executes a single step: resolves its primitive, inputs and params right before the run, builds and writes its
 * envelope, then publishes the output for downstream steps. Failures never escape; they become a {@link StepResult}.
 */
public final class StepRunner {
    private static final Logger LOG = LoggerFactory.getLogger(StepRunner.class);

    private final RegistryManager registry;
    private final ReferenceResolver references;
    private final SemanticTypeRegistry semanticTypes;
    private final EnvelopeBuilder builder;
    private final EnvelopeCodec codec;
    private final Path outputDirectory;
    private final Path envelopeDirectory;
    private final boolean verifyPrimitiveFiles;

    public StepRunner(
        RegistryManager registry,
        ReferenceResolver references,
        SemanticTypeRegistry semanticTypes,
        EnvelopeBuilder builder,
        EnvelopeCodec codec,
        Path outputDirectory,
        Path envelopeDirectory,
        boolean verifyPrimitiveFiles
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.references = Objects.requireNonNull(references, "references");
        this.semanticTypes = Objects.requireNonNull(semanticTypes, "semanticTypes");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
        this.envelopeDirectory = Objects.requireNonNull(envelopeDirectory, "envelopeDirectory");
        this.verifyPrimitiveFiles = verifyPrimitiveFiles;
    }

    public static Path outputPath(Path outputDirectory, String stepId, String outputName, String format) {
        return outputDirectory.resolve(stepId + "_" + outputName + "." + format);
    }

    public static Path envelopePath(Path envelopeDirectory, String stepId, String outputName) {
        return envelopeDirectory.resolve(stepId + "_" + outputName + ".envelope.json");
    }

    public StepResult run(StepDefinition step) {
        LOG.info("Step '{}' starting ({})", step.id(), step.primitive());
        var result = execute(step);
        if (result.success()) {
            LOG.info("Step '{}' finished in {}s", step.id(), result.durationSeconds().orElse(0.0));
        } else {
            LOG.warn("Step '{}' failed: {}: {}", step.id(), result.error().orElse(""), result.message().orElse(""));
        }
        return result;
    }

    private StepResult execute(StepDefinition step) {
        ResolvedPrimitive primitive;
        try {
            primitive = registry.resolve(step.primitive(), verifyPrimitiveFiles);
        } catch (CanopyException ex) {
            return failed(step, StepFailure.PRIMITIVE_RESOLUTION, ex);
        }

        Map<String, ResolvedInput> inputs;
        try {
            inputs = references.resolveStepInputs(step);
        } catch (CanopyException ex) {
            return failed(step, StepFailure.INPUT_RESOLUTION, ex);
        }

        Map<String, Object> params;
        try {
            params = references.resolveStepParams(step);
        } catch (CanopyException ex) {
            return failed(step, StepFailure.PARAMETER_RESOLUTION, ex);
        }

        if (step.outputs().size() != 1) {
            return StepResult.failed(step.id(), StepFailure.INVALID_STEP, null,
                "Currently only single-output steps supported. Step '" + step.id() + "' has " + step.outputs().size() + " outputs.");
        }
        var output = step.outputs().entrySet().iterator().next();
        SemanticType outputType;
        try {
            outputType = semanticTypes.get(output.getValue());
        } catch (CanopyException ex) {
            return failed(step, StepFailure.INVALID_STEP, ex);
        }

        var envelopeInputs = new ArrayList<EnvelopeInput>();
        inputs.forEach((name, input) -> envelopeInputs.add(input.toEnvelopeInput(name)));
        var outputPath = outputPath(outputDirectory, step.id(), output.getKey(), outputType.format());
        var request = new BuildRequest(
            primitive,
            step.version(),
            envelopeInputs,
            outputPath,
            outputType.format(),
            outputType.name(),
            outputType.category(),
            params
        );

        Envelope envelope;
        try {
            var built = builder.build(request);
            if (!built.success()) {
                discardOutput(outputPath);
                return StepResult.failed(
                    step.id(),
                    StepFailure.PRIMITIVE_EXECUTION,
                    built.outcome().errorKind().orElse(ErrorKind.PRIMITIVE_FAILED),
                    built.describeFailure()
                );
            }
            envelope = built.envelope().orElseThrow();
        } catch (CanopyException ex) {
            discardOutput(outputPath);
            return failed(step, StepFailure.PRIMITIVE_EXECUTION, ex);
        } catch (UncheckedIOException ex) {
            discardOutput(outputPath);
            return StepResult.failed(step.id(), StepFailure.PRIMITIVE_EXECUTION, null, ex.getMessage());
        }

        try {
            codec.write(envelope, envelopePath(envelopeDirectory, step.id(), output.getKey()));
        } catch (CanopyException ex) {
            discardOutput(outputPath);
            return failed(step, StepFailure.ENVELOPE_WRITE, ex);
        } catch (UncheckedIOException ex) {
            discardOutput(outputPath);
            return StepResult.failed(step.id(), StepFailure.ENVELOPE_WRITE, null, ex.getMessage());
        }

        var dataPath = Path.of(envelope.data().path());
        references.registerStepOutput(step.id(), output.getKey(), dataPath, envelope);
        return StepResult.succeeded(step.id(), output.getKey(), dataPath, envelope);
    }

    private static StepResult failed(StepDefinition step, StepFailure failure, CanopyException ex) {
        return StepResult.failed(step.id(), failure, ex.kind(), ex.getMessage());
    }

    private static void discardOutput(Path outputPath) {
        try {
            if (Files.deleteIfExists(outputPath)) {
                LOG.debug("Removed partial output {}", outputPath);
            }
        } catch (IOException ex) {
            LOG.warn("Could not remove partial output {}", outputPath, ex);
        }
    }
}

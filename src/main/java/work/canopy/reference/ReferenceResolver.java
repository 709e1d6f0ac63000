package work.canopy.reference;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.canopy.envelope.Envelope;
import work.canopy.error.ErrorKind;
import work.canopy.error.ReferenceException;
import work.canopy.model.Experiment;
import work.canopy.model.Manifest;
import work.canopy.model.StepDefinition;
import work.canopy.shared.EditDistance;

/**
 * Resolves step inputs against the manifest and completed step outputs, and step params against the experiment's
 * choices and parameters. Resolution happens right before a step runs.
 */
public final class ReferenceResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ReferenceResolver.class);
    private static final String DATA_FORMS = "Inputs must reference data: $manifest.{dataset} or $steps.{step}.{output}.";
    private static final String VALUE_FORMS = "Use $choices.{name} or $parameters.{name} for params.";

    private final Manifest manifest;
    private final Experiment experiment;
    private final StepOutputTable stepOutputs;

    public ReferenceResolver(Manifest manifest, Experiment experiment) {
        this(manifest, experiment, new StepOutputTable());
    }

    public ReferenceResolver(Manifest manifest, Experiment experiment, StepOutputTable stepOutputs) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.experiment = Objects.requireNonNull(experiment, "experiment");
        this.stepOutputs = Objects.requireNonNull(stepOutputs, "stepOutputs");
    }

    public StepOutputTable stepOutputs() {
        return stepOutputs;
    }

    public void registerStepOutput(String stepId, String outputName, Path path, Envelope envelope) {
        stepOutputs.register(stepId, Map.of(outputName, new ResolvedInput(path, envelope.semanticType(), Optional.of(envelope))));
    }

    public ResolvedInput resolveInput(String raw, String context) {
        var reference = ReferenceParser.parse(raw, context);
        if (reference instanceof Reference.StepRef step) {
            return resolveStep(step, context);
        }
        if (reference instanceof Reference.ManifestRef dataset) {
            return resolveManifest(dataset, context);
        }
        if (reference instanceof Reference.ChoiceRef || reference instanceof Reference.ParameterRef) {
            var kind = reference instanceof Reference.ChoiceRef ? "$choices" : "$parameters";
            throw new ReferenceException(
                ErrorKind.MISPLACED_REFERENCE,
                "Invalid input reference '" + raw + "'" + in(context) + ". " + kind + " is for params, not inputs. " + DATA_FORMS,
                raw,
                context
            );
        }
        throw new ReferenceException(
            ErrorKind.MISPLACED_REFERENCE,
            "Cannot resolve input reference '" + raw + "'" + in(context) + ". " + DATA_FORMS,
            raw,
            context
        );
    }

    public Map<String, ResolvedInput> resolveStepInputs(StepDefinition step) {
        var resolved = new LinkedHashMap<String, ResolvedInput>();
        for (var entry : step.inputs().entrySet()) {
            var input = resolveInput(entry.getValue(), "step '" + step.id() + "' inputs." + entry.getKey());
            LOG.debug("Step '{}' input {} -> {}", step.id(), entry.getKey(), input.path());
            resolved.put(entry.getKey(), input);
        }
        return resolved;
    }

    public Object resolveParamValue(Object value, String context) {
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list) {
            var resolved = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                resolved.add(resolveParamValue(list.get(i), context + "[" + i + "]"));
            }
            return resolved;
        }
        if (value instanceof Map<?, ?> map) {
            var resolved = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                var key = String.valueOf(entry.getKey());
                resolved.put(key, resolveParamValue(entry.getValue(), context + "." + key));
            }
            return resolved;
        }
        var reference = ReferenceParser.parse(value, context);
        if (reference instanceof Reference.ChoiceRef choice) {
            return lookup(experiment.choices(), choice.name(), "choice", ErrorKind.UNKNOWN_CHOICE, value, context);
        }
        if (reference instanceof Reference.ParameterRef parameter) {
            return lookup(experiment.parameters(), parameter.name(), "parameter", ErrorKind.UNKNOWN_PARAMETER, value, context);
        }
        if (reference.isDataReference()) {
            var kind = reference instanceof Reference.ManifestRef ? "$manifest references data files" : "$steps references data outputs";
            throw new ReferenceException(
                ErrorKind.MISPLACED_REFERENCE,
                "Invalid param reference '" + value + "'" + in(context) + ". " + kind + ", not param values. " + VALUE_FORMS,
                String.valueOf(value),
                context
            );
        }
        return value;
    }

    public Map<String, Object> resolveStepParams(StepDefinition step) {
        var resolved = new LinkedHashMap<String, Object>();
        for (var entry : step.params().entrySet()) {
            resolved.put(entry.getKey(), resolveParamValue(entry.getValue(), "step '" + step.id() + "' params." + entry.getKey()));
        }
        return resolved;
    }

    private ResolvedInput resolveStep(Reference.StepRef reference, String context) {
        var outputs = stepOutputs.outputsOf(reference.stepId());
        if (outputs.isEmpty()) {
            if (experiment.step(reference.stepId()).isPresent()) {
                throw new ReferenceException(
                    ErrorKind.STEP_NOT_EXECUTED,
                    "Step '" + reference.stepId() + "' has not been executed yet" + in(context)
                        + ". Steps must be ordered so dependencies run first.",
                    reference.toString(),
                    context
                );
            }
            var known = experiment.stepIds();
            throw new ReferenceException(
                ErrorKind.UNKNOWN_STEP,
                "Unknown step '" + reference.stepId() + "'" + in(context) + ". Available steps: " + available(known),
                reference.toString(),
                context,
                EditDistance.closeMatches(reference.stepId(), known)
            );
        }
        var output = outputs.get().get(reference.output());
        if (output == null) {
            throw new ReferenceException(
                ErrorKind.UNKNOWN_STEP_OUTPUT,
                "Step '" + reference.stepId() + "' has no output named '" + reference.output() + "'" + in(context)
                    + ". Available outputs from '" + reference.stepId() + "': " + available(outputs.get().keySet()),
                reference.toString(),
                context,
                List.copyOf(new TreeSet<>(outputs.get().keySet()))
            );
        }
        return output;
    }

    private ResolvedInput resolveManifest(Reference.ManifestRef reference, String context) {
        var dataset = manifest.dataset(reference.dataset());
        if (dataset.isEmpty()) {
            throw new ReferenceException(
                ErrorKind.UNKNOWN_DATASET,
                "Manifest has no dataset '" + reference.dataset() + "'" + in(context) + ". Available datasets in "
                    + manifest.cityId() + " manifest: " + available(manifest.datasets().keySet()),
                reference.toString(),
                context,
                EditDistance.closeMatches(reference.dataset(), manifest.datasets().keySet())
            );
        }
        var path = manifest.resolve(dataset.get());
        if (!Files.exists(path)) {
            throw new ReferenceException(
                ErrorKind.DATASET_FILE_MISSING,
                "Dataset '" + reference.dataset() + "' declared in manifest but file not found" + in(context)
                    + ". Expected path: " + path + ". Run data fetch/download first, or check manifest cache path.",
                reference.toString(),
                context
            );
        }
        return new ResolvedInput(path, dataset.get().semanticType(), Optional.empty());
    }

    private static Object lookup(Map<String, Object> values, String name, String noun, ErrorKind kind, Object raw, String context) {
        if (values.containsKey(name)) {
            return values.get(name);
        }
        var suggestions = EditDistance.closeMatches(name, values.keySet());
        var hint = suggestions.isEmpty() ? "" : " Did you mean: " + String.join(", ", suggestions) + "?";
        throw new ReferenceException(
            kind,
            "Unknown " + noun + " '" + name + "'" + in(context) + ". Available " + noun + "s: " + available(values.keySet()) + "." + hint,
            String.valueOf(raw),
            context,
            suggestions
        );
    }

    private static String available(Collection<String> names) {
        return names.isEmpty() ? "(none)" : String.join(", ", new TreeSet<>(names));
    }

    private static String in(String context) {
        return context == null || context.isBlank() ? "" : " (in " + context + ")";
    }
}

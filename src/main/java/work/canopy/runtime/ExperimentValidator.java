package work.canopy.runtime;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.canopy.api.ValidationReport;
import work.canopy.error.CanopyException;
import work.canopy.model.Experiment;
import work.canopy.model.Manifest;
import work.canopy.model.Method;
import work.canopy.model.StepDefinition;
import work.canopy.parse.MethodParser;
import work.canopy.plan.DependencyResolver;
import work.canopy.reference.Reference;
import work.canopy.reference.ReferenceParser;
import work.canopy.registry.RegistryManager;
import work.canopy.types.SemanticTypeRegistry;

/**
 * Pre-run checks. Every problem is collected; nothing is raised. Method cross-check findings are warnings only.
 */
public final class ExperimentValidator {
    private static final Logger LOG = LoggerFactory.getLogger(ExperimentValidator.class);
    private static final String METHODS_PREFIX = "$methods/";
    private static final String METHODS_DIRECTORY = "garden/methods";

    private final Experiment experiment;
    private final Manifest manifest;
    private final RegistryManager registry;
    private final SemanticTypeRegistry semanticTypes;
    private final Path projectRoot;
    private final boolean verifyPrimitiveFiles;

    public ExperimentValidator(
        Experiment experiment,
        Manifest manifest,
        RegistryManager registry,
        SemanticTypeRegistry semanticTypes,
        Path projectRoot,
        boolean verifyPrimitiveFiles
    ) {
        this.experiment = Objects.requireNonNull(experiment, "experiment");
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.semanticTypes = Objects.requireNonNull(semanticTypes, "semanticTypes");
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
        this.verifyPrimitiveFiles = verifyPrimitiveFiles;
    }

    public ValidationReport validate() {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        errors.addAll(registry.validateAllPrimitives(experiment, verifyPrimitiveFiles));
        for (var step : experiment.steps()) {
            checkInputs(step, errors);
            step.params().forEach((name, value) -> checkParam(step, name, value, errors));
            checkOutputs(step, errors);
        }
        try {
            new DependencyResolver(experiment).createExecutionPlan();
        } catch (CanopyException ex) {
            errors.add(ex.getMessage());
        }
        checkMethodChoices(warnings);

        errors.forEach(error -> LOG.debug("Validation error: {}", error));
        warnings.forEach(warning -> LOG.warn("Validation warning: {}", warning));
        return new ValidationReport(errors, warnings);
    }

    private void checkInputs(StepDefinition step, List<String> errors) {
        for (var entry : step.inputs().entrySet()) {
            var context = "step '" + step.id() + "' inputs." + entry.getKey();
            Reference reference;
            try {
                reference = ReferenceParser.parse(entry.getValue(), context);
            } catch (CanopyException ex) {
                errors.add(ex.getMessage());
                continue;
            }
            if (reference instanceof Reference.ManifestRef dataset) {
                if (manifest.dataset(dataset.dataset()).isEmpty()) {
                    errors.add("Step '" + step.id() + "' references " + dataset + ", but manifest has no dataset '" + dataset.dataset() + "'");
                }
            } else if (!reference.isDataReference()) {
                errors.add("Step '" + step.id() + "' input '" + entry.getKey() + "' is '" + entry.getValue()
                    + "'; inputs must reference data: $manifest.{dataset} or $steps.{step}.{output}");
            }
        }
    }

    private void checkParam(StepDefinition step, String path, Object value, List<String> errors) {
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                checkParam(step, path + "[" + i + "]", list.get(i), errors);
            }
            return;
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, item) -> checkParam(step, path + "." + key, item, errors));
            return;
        }
        Reference reference;
        try {
            reference = ReferenceParser.parse(value, "step '" + step.id() + "' params." + path);
        } catch (CanopyException ex) {
            errors.add(ex.getMessage());
            return;
        }
        if (reference instanceof Reference.ChoiceRef choice && !experiment.choices().containsKey(choice.name())) {
            errors.add("Step '" + step.id() + "' param " + path + " references " + choice + ", but no such choice exists");
        } else if (reference instanceof Reference.ParameterRef parameter && !experiment.parameters().containsKey(parameter.name())) {
            errors.add("Step '" + step.id() + "' param " + path + " references " + parameter + ", but no such parameter exists");
        } else if (reference.isDataReference()) {
            errors.add("Step '" + step.id() + "' param " + path + " is '" + value
                + "'; params may only reference $choices.{name} or $parameters.{name}");
        }
    }

    private void checkOutputs(StepDefinition step, List<String> errors) {
        if (step.outputs().size() != 1) {
            errors.add("Step '" + step.id() + "' declares " + step.outputs().size() + " outputs; exactly one output is supported");
            return;
        }
        for (var semanticType : step.outputs().values()) {
            try {
                semanticTypes.get(semanticType);
            } catch (CanopyException ex) {
                errors.add("Step '" + step.id() + "': " + ex.getMessage());
            }
        }
    }

    private void checkMethodChoices(List<String> warnings) {
        var methodRef = experiment.lineage().methodRef();
        if (methodRef.isBlank()) {
            return;
        }
        var methodPath = methodPath(projectRoot, methodRef);
        if (!Files.exists(methodPath)) {
            warnings.add("Method file not found: " + methodPath + ". Choice validation skipped.");
            return;
        }
        Method method;
        try {
            method = MethodParser.load(methodPath);
        } catch (RuntimeException ex) {
            warnings.add("Could not parse method file " + methodPath + ": " + ex.getMessage() + ". Choice validation skipped.");
            return;
        }
        experiment.choices().forEach((name, value) -> {
            var declared = Optional.ofNullable(method.choices().get(name));
            if (declared.isEmpty()) {
                warnings.add("Choice '" + name + "' not declared in method '" + method.name() + "'. This may be intentional experimentation.");
            } else if (!declared.get().options().contains(value)) {
                warnings.add("Choice '" + name + ": " + value + "' not in method options " + declared.get().options() + ". Proceeding anyway.");
            }
        });
        for (var name : method.choices().keySet()) {
            if (!experiment.choices().containsKey(name)) {
                warnings.add("Method '" + method.name() + "' declares choice '" + name + "', but experiment does not provide it. Default may be used.");
            }
        }
    }

    /**
     * {@code $methods/thermal/buffer} resolves to {@code garden/methods/thermal/buffer.yml} under the project root.
     */
    static Path methodPath(Path projectRoot, String methodRef) {
        var ref = methodRef.startsWith(METHODS_PREFIX) ? methodRef.substring(METHODS_PREFIX.length()) : methodRef;
        if (!ref.endsWith(".yml")) {
            ref = ref + ".yml";
        }
        return projectRoot.resolve(METHODS_DIRECTORY).resolve(ref);
    }
}

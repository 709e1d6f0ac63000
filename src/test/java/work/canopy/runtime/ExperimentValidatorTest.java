package work.canopy.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.canopy.api.ValidationReport;
import work.canopy.parse.ExperimentParser;
import work.canopy.parse.ManifestParser;
import work.canopy.registry.RegistryCache;
import work.canopy.registry.RegistryManager;
import work.canopy.support.FixtureProject;
import work.canopy.types.SemanticTypeRegistry;

class ExperimentValidatorTest {
    @TempDir
    Path tempDir;

    private FixtureProject project;

    @BeforeEach
    void setUp() {
        project = FixtureProject.in(tempDir)
            .primitive("soil/validate_vector")
            .primitive("roots/generate_buffers")
            .semanticType("park_boundaries", "vector", "geojson")
            .semanticType("park_buffers", "vector", "geojson")
            .dataset("parks", "park_boundaries");
    }

    @Test
    void wellFormedExperimentIsValid() {
        var report = validate(project.experiment("""
            id: ok
            name: OK
            city: testville
            manifest: plots/testville/manifest.yml
            choices:
              distance: 30
            steps:
              - id: validate
                primitive: soil/validate_vector
                inputs:
                  data: $manifest.parks
                outputs:
                  validated: park_boundaries
              - id: buffer
                primitive: roots/generate_buffers
                inputs:
                  parks: $steps.validate.validated
                outputs:
                  buffers: park_buffers
                params:
                  distance: $choices.distance
            """), true);

        assertTrue(report.valid(), report::describeErrors);
        assertEquals(List.of(), report.warnings());
    }

    @Test
    void collectsEveryProblemInsteadOfStoppingAtTheFirst() {
        var report = validate(project.experiment("""
            id: broken
            name: Broken
            city: testville
            manifest: plots/testville/manifest.yml
            parameters:
              resolution: 30
            steps:
              - id: a
                primitive: roots/generate_bufers
                inputs:
                  data: $manifest.lakes
                outputs:
                  out: park_buffers
              - id: b
                primitive: soil/validate_vector
                inputs:
                  data: $choices.distance
                  other: $params.x
                outputs:
                  out: park_bufers
                params:
                  nested:
                    - $parameters.resolutoin
                    - $manifest.parks
              - id: c
                primitive: soil/validate_vector
                outputs:
                  one: park_buffers
                  two: park_buffers
            """), true);

        var errors = report.errors();
        assertEquals(8, errors.size(), report::describeErrors);
        assertTrue(errors.get(0).startsWith("Step 'a': "));
        assertTrue(errors.stream().anyMatch(error -> error.contains("no dataset 'lakes'")));
        assertTrue(errors.stream().anyMatch(error -> error.contains("inputs must reference data")));
        assertTrue(errors.stream().anyMatch(error -> error.contains("$parameters.")));
        assertTrue(errors.stream().anyMatch(error -> error.contains("Unknown semantic type: 'park_bufers'")));
        assertTrue(errors.stream().anyMatch(error -> error.contains("param nested[0] references $parameters.resolutoin")));
        assertTrue(errors.stream().anyMatch(error -> error.contains("param nested[1] is '$manifest.parks'")));
        assertTrue(errors.stream().anyMatch(error -> error.contains("declares 2 outputs")));
        assertTrue(report.describeErrors().startsWith("Validation failed:\n  - "));
    }

    @Test
    void reportsCyclesAndUnknownStepReferences() {
        var cyclic = validate(project.experiment("cyclic.yml", """
            id: cyclic
            name: Cyclic
            city: testville
            manifest: plots/testville/manifest.yml
            steps:
              - id: a
                primitive: soil/validate_vector
                inputs:
                  data: $steps.b.out
                outputs:
                  out: park_boundaries
              - id: b
                primitive: soil/validate_vector
                inputs:
                  data: $steps.a.out
                outputs:
                  out: park_boundaries
            """), true);
        assertEquals(1, cyclic.errors().size());
        assertTrue(cyclic.errors().get(0).startsWith("Circular dependency detected"));

        var dangling = validate(project.experiment("dangling.yml", """
            id: dangling
            name: Dangling
            city: testville
            manifest: plots/testville/manifest.yml
            steps:
              - id: a
                primitive: soil/validate_vector
                inputs:
                  data: $steps.ghost.out
                outputs:
                  out: park_boundaries
            """), true);
        assertEquals(List.of("Step 'a' references unknown step 'ghost'. Available steps: a"), dangling.errors());
    }

    @Test
    void missingPrimitiveFileCanBeTolerated() {
        project.primitiveWithoutFile("roots/zonal_stats");
        var experiment = project.experiment("""
            id: stats
            name: Stats
            city: testville
            manifest: plots/testville/manifest.yml
            steps:
              - id: stats
                primitive: roots/zonal_stats
                inputs:
                  zones: $manifest.parks
                outputs:
                  table: park_boundaries
            """);

        assertEquals(1, validate(experiment, true).errors().size());
        assertTrue(validate(experiment, false).valid());
    }

    @Test
    void methodChoicesOnlyProduceWarnings() {
        project.method("thermal/buffer_gradient.yml", """
            name: Buffer gradient
            choices:
              buffer_distances:
                options: [[30, 60, 90], [50, 100]]
              temperature_source:
                options: [landsat, modis]
            """);
        var report = validate(project.experiment("""
            id: heat
            name: Heat
            city: testville
            manifest: plots/testville/manifest.yml
            method:
              ref: $methods/thermal/buffer_gradient
            choices:
              buffer_distances: [10, 20]
              smoothing: gaussian
            steps:
              - id: validate
                primitive: soil/validate_vector
                inputs:
                  data: $manifest.parks
                outputs:
                  validated: park_boundaries
            """), true);

        assertTrue(report.valid(), report::describeErrors);
        assertEquals(3, report.warnings().size(), String.valueOf(report.warnings()));
        assertTrue(report.warnings().get(0).startsWith("Choice 'buffer_distances: [10, 20]' not in method options"));
        assertTrue(report.warnings().get(1).startsWith("Choice 'smoothing' not declared in method 'Buffer gradient'"));
        assertTrue(report.warnings().get(2).contains("declares choice 'temperature_source'"));
    }

    @Test
    void missingMethodFileIsAWarning() {
        var report = validate(project.experiment("""
            id: heat
            name: Heat
            city: testville
            manifest: plots/testville/manifest.yml
            method:
              ref: $methods/nowhere
            steps: []
            """), true);

        assertTrue(report.valid());
        assertEquals(1, report.warnings().size());
        assertTrue(report.warnings().get(0).startsWith("Method file not found"));
        assertEquals(tempDir.resolve("garden/methods/thermal/x.yml"), ExperimentValidator.methodPath(tempDir, "$methods/thermal/x"));
    }

    @Test
    void unparseableMethodFileIsAWarning() {
        project.method("broken.yml", "choices: [unclosed\n");
        var report = validate(project.experiment("""
            id: heat
            name: Heat
            city: testville
            manifest: plots/testville/manifest.yml
            method:
              ref: $methods/broken
            choices:
              smoothing: gaussian
            steps: []
            """), true);

        assertTrue(report.valid(), report::describeErrors);
        assertEquals(1, report.warnings().size(), String.valueOf(report.warnings()));
        assertTrue(report.warnings().get(0).startsWith("Could not parse method file " + project.root().resolve("garden/methods/broken.yml")));
    }

    private ValidationReport validate(Path experimentPath, boolean verifyFiles) {
        var experiment = ExperimentParser.load(experimentPath);
        var manifest = ManifestParser.load(project.root().resolve(experiment.manifestPath()));
        var registry = new RegistryManager(new RegistryCache(project.root()));
        var types = SemanticTypeRegistry.load(project.root().resolve(SemanticTypeRegistry.DEFAULT_LOCATION));
        return new ExperimentValidator(experiment, manifest, registry, types, project.root(), verifyFiles).validate();
    }
}

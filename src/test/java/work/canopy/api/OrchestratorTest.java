package work.canopy.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.canopy.envelope.EnvelopeCodec;
import work.canopy.envelope.EnvelopeSchema;
import work.canopy.envelope.ProvenanceEntry;
import work.canopy.error.ErrorKind;
import work.canopy.parse.YamlDocuments;
import work.canopy.runtime.StepRunner;
import work.canopy.shared.Values;
import work.canopy.support.FixtureProject;
import work.canopy.support.ScriptedExecutor;

class OrchestratorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-04T10:15:30Z"), ZoneOffset.UTC);

    private static final String DIAMOND = """
        id: park_cooling
        name: Park cooling
        curiosity:
          ref: $curiosities/urban_heat
          sub_question: Do parks cool their surroundings?
        method:
          ref: $methods/thermal/buffer_gradient
        city: testville
        manifest: plots/testville/manifest.yml
        choices:
          buffer_distances: [30, 60, 90]
        parameters:
          resolution: 30
        steps:
          - id: c
            primitive: roots/zonal_stats
            inputs:
              x: $steps.a.validated
              y: $steps.b.buffers
            outputs:
              table: zonal_statistics
          - id: b
            primitive: roots/generate_buffers
            inputs:
              parks: $manifest.parks
            outputs:
              buffers: park_buffers
            params:
              distances: $choices.buffer_distances
              resolution: $parameters.resolution
          - id: a
            primitive: soil/validate_vector
            inputs:
              data: $manifest.parks
            outputs:
              validated: park_boundaries
        """;

    private static final String CHAIN = """
        id: chain
        name: Chain
        city: testville
        manifest: plots/testville/manifest.yml
        steps:
          - id: step1
            primitive: soil/validate_vector
            inputs:
              data: $manifest.parks
            outputs:
              validated: park_boundaries
          - id: step2
            primitive: roots/generate_buffers
            inputs:
              parks: $steps.step1.validated
            outputs:
              buffers: park_buffers
          - id: step3
            primitive: roots/zonal_stats
            inputs:
              zones: $steps.step2.buffers
            outputs:
              table: zonal_statistics
        """;

    @TempDir
    Path tempDir;

    private FixtureProject project;
    private ScriptedExecutor executor;
    private EnvelopeCodec codec;

    @BeforeEach
    void setUp() {
        project = FixtureProject.in(tempDir)
            .primitive("soil/validate_vector")
            .passthroughPrimitive("soil/check_crs")
            .primitive("roots/generate_buffers")
            .primitive("roots/zonal_stats")
            .semanticType("park_boundaries", "vector", "geojson")
            .semanticType("park_buffers", "vector", "geojson")
            .semanticType("zonal_statistics", "tabular", "csv")
            .dataset("parks", "park_boundaries");
        executor = new ScriptedExecutor();
        codec = new EnvelopeCodec(EnvelopeSchema.bundled());
    }

    @Test
    void runsStepsInDependencyOrderAndMergesProvenance() {
        var result = orchestrator(project.experiment(DIAMOND), 1).run();

        assertTrue(result.success(), () -> result.error().orElse(""));
        assertEquals(List.of("a", "b", "c"), result.completedSteps());
        assertEquals(List.of("validate_vector", "generate_buffers", "zonal_stats"), executor.invokedPrimitives());
        assertEquals(Optional.empty(), result.failedStep());

        var c = result.finalEnvelopes().get("c");
        assertEquals(3, c.provenance().size());
        assertEquals(List.of(Optional.of("x"), Optional.of("y"), Optional.empty()),
            c.provenance().stream().map(ProvenanceEntry::lineageBranch).toList());
        assertEquals(List.of("validate_vector", "generate_buffers", "zonal_stats"),
            c.provenance().stream().map(ProvenanceEntry::primitive).toList());
        assertEquals("zonal_statistics", c.semanticType());
        assertEquals("tabular", c.metadata().get("data_category"));
        assertEquals("EPSG:3857", c.metadata().get("crs"));
        assertFalse(c.metadata().containsKey("status"));

        var bParams = result.stepResults().get("b").envelope().orElseThrow().provenance().get(0).params();
        assertEquals(Map.of("distances", List.of(30, 60, 90), "resolution", 30), bParams);

        var cInvocation = executor.invocations().get(2);
        assertEquals(project.dataDirectory().resolve("a_validated.geojson"), cInvocation.inputs().get("x"));
        assertEquals(project.dataDirectory().resolve("c_table.csv"), cInvocation.outputPath());
        assertTrue(Files.exists(project.dataDirectory().resolve("c_table.csv")));
    }

    @Test
    void onlySinkEnvelopesCarryLineage() {
        var result = orchestrator(project.experiment(DIAMOND), 1).run();
        assertTrue(result.success());
        assertEquals(List.of("c"), List.copyOf(result.finalEnvelopes().keySet()));

        var lineage = Values.asMap(result.finalEnvelopes().get("c").metadata().get("lineage"));
        assertEquals("$curiosities/urban_heat", lineage.get("curiosity"));
        assertEquals("Do parks cool their surroundings?", lineage.get("sub_question"));
        assertEquals("$methods/thermal/buffer_gradient", lineage.get("method"));
        assertEquals(Map.of("buffer_distances", List.of(30, 60, 90)), lineage.get("choices"));
        assertEquals(Map.of("resolution", 30), lineage.get("parameters"));

        var onDisk = codec.read(StepRunner.envelopePath(project.envelopeDirectory(), "c", "table"));
        assertTrue(onDisk.valid(), () -> String.valueOf(onDisk.violations()));
        assertTrue(onDisk.envelope().metadata().containsKey("lineage"));

        var intermediate = codec.read(StepRunner.envelopePath(project.envelopeDirectory(), "a", "validated"));
        assertFalse(intermediate.envelope().metadata().containsKey("lineage"));
        assertFalse(result.stepResults().get("a").envelope().orElseThrow().metadata().containsKey("lineage"));
    }

    @Test
    void stopsAtFirstFailureAndRemovesPartialOutput() {
        executor.failing("generate_buffers", "CRS mismatch", "expected EPSG:3857");

        var result = orchestrator(project.experiment(CHAIN), 1).run();

        assertFalse(result.success());
        assertEquals(1, result.exitCode());
        assertEquals(List.of("step1"), result.completedSteps());
        assertEquals(Optional.of("step2"), result.failedStep());
        assertEquals(Optional.of("Primitive execution failed: CRS mismatch: expected EPSG:3857"), result.error());
        assertEquals(List.of("validate_vector", "generate_buffers"), executor.invokedPrimitives());

        var step2 = result.stepResults().get("step2");
        assertEquals(Optional.of(StepFailure.PRIMITIVE_EXECUTION), step2.failure());
        assertEquals(Optional.of(ErrorKind.PRIMITIVE_FAILED), step2.errorKind());
        assertFalse(result.stepResults().containsKey("step3"));

        assertTrue(Files.exists(project.dataDirectory().resolve("step1_validated.geojson")));
        assertFalse(Files.exists(project.dataDirectory().resolve("step2_buffers.geojson")));
        assertFalse(Files.exists(StepRunner.envelopePath(project.envelopeDirectory(), "step2", "buffers")));
        assertFalse(Files.exists(project.dataDirectory().resolve("step3_table.csv")));
        assertFalse(Files.exists(StepRunner.envelopePath(project.envelopeDirectory(), "step3", "table")));
        assertTrue(result.finalEnvelopes().isEmpty());
    }

    @Test
    void missingDatasetFileFailsTheStepBeforeItsPrimitiveRuns() {
        project.declaredDataset("lakes", "park_boundaries");
        var result = orchestrator(project.experiment("""
            id: lakes
            name: Lakes
            city: testville
            manifest: plots/testville/manifest.yml
            steps:
              - id: validate
                primitive: soil/validate_vector
                inputs:
                  data: $manifest.lakes
                outputs:
                  validated: park_boundaries
            """), 1).run();

        assertFalse(result.success());
        var step = result.stepResults().get("validate");
        assertEquals(Optional.of(StepFailure.INPUT_RESOLUTION), step.failure());
        assertEquals(Optional.of(ErrorKind.DATASET_FILE_MISSING), step.errorKind());
        assertTrue(executor.invocations().isEmpty());
    }

    @Test
    void invalidExperimentIsReportedAndLoggedWithoutRunningAnything() throws Exception {
        var result = orchestrator(project.experiment("""
            id: invalid
            name: Invalid
            city: testville
            manifest: plots/testville/manifest.yml
            steps:
              - id: broken
                primitive: roots/no_such_primitive
                inputs:
                  data: $manifest.parks
                outputs:
                  out: park_boundaries
            """), 1).run();

        assertFalse(result.success());
        assertTrue(result.error().orElseThrow().startsWith("Validation failed:\n  - Step 'broken': "));
        assertTrue(result.completedSteps().isEmpty());
        assertTrue(executor.invocations().isEmpty());

        var runLog = result.runLog().orElseThrow();
        assertEquals(tempDir.resolve("compost/logs/invalid_20260504_101530.yml"), runLog);
        var document = YamlDocuments.load(runLog);
        assertEquals(false, Values.asMap(document.get("result")).get("success"));
        assertEquals(List.of(), document.get("steps"));
    }

    @Test
    void writesRunLogWithStepSummaries() {
        executor.warning("validate_vector", "warning", "2 invalid geometries repaired");

        var result = orchestrator(project.experiment(DIAMOND), 1).run();

        var document = YamlDocuments.load(result.runLog().orElseThrow());
        assertEquals("park_cooling_20260504_101530", document.get("run_id"));
        assertEquals("testville", document.get("city"));
        assertEquals("full", document.get("profile"));
        assertEquals(true, Values.asMap(document.get("result")).get("success"));
        var steps = Values.asList(document.get("steps"));
        assertEquals(3, steps.size());
        assertEquals("a", Values.asMap(steps.get(0)).get("id"));
        assertEquals(1, Values.asMap(steps.get(0)).get("warning_count"));
        var summary = Values.asMap(document.get("summary"));
        assertEquals(3, summary.get("total_steps"));
        assertEquals(3, summary.get("completed_steps"));

        var c = result.finalEnvelopes().get("c");
        assertEquals(1, c.warnings().size());
        assertEquals("validate_vector", c.warnings().get(0).primitive());
    }

    @Test
    void parallelRunProducesTheSameResult() {
        var result = orchestrator(project.experiment(DIAMOND), 3).run();

        assertTrue(result.success(), () -> result.error().orElse(""));
        assertEquals(3, result.completedSteps().size());
        assertEquals("c", result.completedSteps().get(2));
        var c = result.finalEnvelopes().get("c");
        assertEquals(List.of(Optional.of("x"), Optional.of("y"), Optional.empty()),
            c.provenance().stream().map(ProvenanceEntry::lineageBranch).toList());
    }

    @Test
    void passthroughOutputPointsDownstreamAtTheOriginalFile() {
        var result = orchestrator(project.experiment("""
            id: passthrough
            name: Passthrough
            city: testville
            manifest: plots/testville/manifest.yml
            steps:
              - id: check
                primitive: soil/check_crs
                inputs:
                  data: $manifest.parks
                outputs:
                  checked: park_boundaries
              - id: buffer
                primitive: roots/generate_buffers
                inputs:
                  parks: $steps.check.checked
                outputs:
                  buffers: park_buffers
            """), 1).run();

        assertTrue(result.success(), () -> result.error().orElse(""));
        var parks = project.datasetPath("parks");
        assertEquals(parks.toString(), result.stepResults().get("check").envelope().orElseThrow().data().path());
        assertEquals(Map.of("checked", parks), result.stepResults().get("check").outputPaths());
        assertEquals(parks, executor.invocations().get(1).inputs().get("parks"));
        assertFalse(Files.exists(project.dataDirectory().resolve("check_checked.geojson")));
    }

    @Test
    void serializableResultListsSinkOutputs() {
        var result = orchestrator(project.experiment(DIAMOND), 1).run();

        var map = result.toSerializableMap();
        assertEquals("success", map.get("status"));
        assertEquals("park_cooling", map.get("experiment"));
        assertEquals(Map.of("c", project.dataDirectory().resolve("c_table.csv").toString()), map.get("outputs"));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"success\""));
    }

    @Test
    void unparseableMethodDocumentOnlyWarns() {
        project.method("thermal/buffer_gradient.yml", "name: [unclosed\nchoices: {\n");

        var result = orchestrator(project.experiment(DIAMOND), 1).run();

        assertTrue(result.success(), () -> result.error().orElse(""));
        assertEquals(1, result.warnings().size(), String.valueOf(result.warnings()));
        assertTrue(result.warnings().get(0).startsWith("Could not parse method file"));
        assertEquals(List.of("a", "b", "c"), result.completedSteps());
    }

    @Test
    void failedLineageRewriteRemovesTheSinkFiles() {
        project.write(tempDir.resolve(EnvelopeSchema.PROJECT_LOCATION), """
            {
              "$schema": "https://json-schema.org/draft/2020-12/schema",
              "type": "object",
              "required": ["data", "metadata", "provenance", "warnings"],
              "properties": {
                "metadata": {"type": "object", "not": {"required": ["lineage"]}}
              }
            }
            """);

        var result = orchestrator(project.experiment(DIAMOND), 1).run();

        assertFalse(result.success());
        assertEquals(List.of("a", "b"), result.completedSteps());
        assertEquals(Optional.of("c"), result.failedStep());
        var c = result.stepResults().get("c");
        assertEquals(Optional.of(StepFailure.ENVELOPE_WRITE), c.failure());
        assertEquals(Optional.of(ErrorKind.ENVELOPE_INVALID), c.errorKind());
        assertTrue(result.finalEnvelopes().isEmpty());

        assertFalse(Files.exists(project.dataDirectory().resolve("c_table.csv")));
        assertFalse(Files.exists(StepRunner.envelopePath(project.envelopeDirectory(), "c", "table")));
        assertTrue(Files.exists(StepRunner.envelopePath(project.envelopeDirectory(), "a", "validated")));
        assertTrue(Files.exists(project.datasetPath("parks")));
    }

    private Orchestrator orchestrator(Path experiment, int parallel) {
        var configuration = project.configuration(experiment).maxParallelSteps(parallel).build();
        return new Orchestrator(configuration, executor, CLOCK);
    }
}

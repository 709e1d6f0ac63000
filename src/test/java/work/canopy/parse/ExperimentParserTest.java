package work.canopy.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.canopy.error.DocumentParseException;
import work.canopy.error.ErrorCategory;
import work.canopy.error.ErrorKind;

class ExperimentParserTest {
    private static final String EXPERIMENT = """
        id: heat_buffers
        name: Heat around parks
        description: Buffers and temperature
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
          - id: validate
            primitive: soil/validate_vector
            inputs:
              data: $manifest.parks
            outputs:
              validated: park_boundaries
          - id: buffer
            primitive: roots/generate_buffers
            version: 2.1.0
            description: Rings around parks
            inputs:
              parks: $steps.validate.validated
            outputs:
              buffers: park_buffers
            params:
              distances: $choices.buffer_distances
              options:
                resolution: $parameters.resolution
        """;

    @Test
    void parsesExperimentDocument() {
        var experiment = ExperimentParser.fromMap(YamlDocuments.parse(EXPERIMENT, "experiment.yml"), "experiment.yml");

        assertEquals("heat_buffers", experiment.id());
        assertEquals("testville", experiment.city());
        assertEquals("plots/testville/manifest.yml", experiment.manifestPath());
        assertEquals(List.of("validate", "buffer"), experiment.stepIds());
        assertEquals("$curiosities/urban_heat", experiment.lineage().curiosityRef());
        assertEquals(Optional.of("Do parks cool their surroundings?"), experiment.lineage().subQuestion());
        assertEquals("$methods/thermal/buffer_gradient", experiment.lineage().methodRef());
        assertEquals(List.of(30, 60, 90), experiment.choices().get("buffer_distances"));
        assertEquals(experiment.choices(), experiment.lineage().choices());

        var validate = experiment.step("validate").orElseThrow();
        assertEquals("1.0.0", validate.version());
        assertEquals("", validate.description());
        assertEquals(Map.of("data", "$manifest.parks"), validate.inputs());

        var buffer = experiment.step("buffer").orElseThrow();
        assertEquals("2.1.0", buffer.version());
        assertEquals(Map.of("resolution", "$parameters.resolution"), buffer.params().get("options"));
    }

    @Test
    void rejectsDuplicateStepIds() {
        var yaml = """
            id: dup
            name: Duplicate
            city: testville
            manifest: m.yml
            steps:
              - id: a
                primitive: roots/x
              - id: a
                primitive: roots/y
            """;
        var ex = assertThrows(DocumentParseException.class,
            () -> ExperimentParser.fromMap(YamlDocuments.parse(yaml, "dup.yml"), "dup.yml"));
        assertEquals(ErrorKind.DUPLICATE_STEP_ID, ex.kind());
        assertEquals(ErrorCategory.STRUCTURAL_PARSE, ex.category());
    }

    @Test
    void requiresIdentityFields() {
        var ex = assertThrows(DocumentParseException.class,
            () -> ExperimentParser.fromMap(YamlDocuments.parse("name: no id\n", "bad.yml"), "bad.yml"));
        assertEquals(ErrorKind.MISSING_FIELD, ex.kind());
        assertTrue(ex.getMessage().contains("id"));
    }

    @Test
    void rejectsNonStringInputs() {
        var yaml = """
            id: e
            name: E
            city: testville
            manifest: m.yml
            steps:
              - id: a
                primitive: roots/x
                inputs:
                  data: [1, 2]
            """;
        var ex = assertThrows(DocumentParseException.class,
            () -> ExperimentParser.fromMap(YamlDocuments.parse(yaml, "e.yml"), "e.yml"));
        assertEquals(ErrorKind.MALFORMED_DOCUMENT, ex.kind());
    }

    @Test
    void malformedYamlIsAStructuralError() {
        var ex = assertThrows(DocumentParseException.class, () -> YamlDocuments.parse("id: [unclosed", "broken.yml"));
        assertEquals(ErrorCategory.STRUCTURAL_PARSE, ex.category());
    }
}

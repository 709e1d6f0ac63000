package work.canopy.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.canopy.error.ErrorKind;
import work.canopy.error.GraphException;
import work.canopy.model.Experiment;
import work.canopy.parse.ExperimentParser;
import work.canopy.parse.YamlDocuments;

class DependencyResolverTest {
    @Test
    void ordersByReferencesNotDeclarationOrder() {
        var experiment = experiment("""
              - id: stats
                primitive: roots/zonal_stats
                inputs:
                  zones: $steps.buffer.rings
                  raster: $steps.heat.lst
              - id: buffer
                primitive: roots/generate_buffers
                inputs:
                  parks: $manifest.parks
              - id: heat
                primitive: roots/fetch_lst
                inputs:
                  area: $manifest.boundary
            """);

        var plan = new DependencyResolver(experiment).createExecutionPlan();

        assertEquals(List.of("buffer", "heat", "stats"), plan.stepsInOrder());
        assertEquals(Set.of("buffer", "heat"), plan.dependenciesOf("stats"));
        assertEquals(Set.of(), plan.dependenciesOf("buffer"));
        assertEquals(List.of("stats"), plan.sinks());
    }

    @Test
    void independentStepsAreOrderedLexicographically() {
        var graph = new LinkedHashMap<String, Set<String>>();
        graph.put("zeta", Set.of());
        graph.put("alpha", Set.of());
        graph.put("mid", Set.of("zeta"));
        graph.put("beta", Set.of("alpha"));

        var first = DependencyResolver.topologicalSort(graph);
        assertEquals(List.of("alpha", "beta", "zeta", "mid"), first);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, DependencyResolver.topologicalSort(graph));
        }
    }

    @Test
    void detectsCycleWithItsPath() {
        var experiment = experiment("""
              - id: a
                primitive: roots/x
                inputs:
                  data: $steps.c.out
              - id: b
                primitive: roots/x
                inputs:
                  data: $steps.a.out
              - id: c
                primitive: roots/x
                inputs:
                  data: $steps.b.out
            """);

        var ex = assertThrows(GraphException.class, () -> new DependencyResolver(experiment).createExecutionPlan());
        assertEquals(ErrorKind.DEPENDENCY_CYCLE, ex.kind());
        var cycle = ex.cycle();
        assertEquals(4, cycle.size());
        assertEquals(cycle.get(0), cycle.get(cycle.size() - 1));
        assertTrue(cycle.containsAll(List.of("a", "b", "c")));
        assertTrue(ex.getMessage().contains(String.join(" -> ", cycle)));
    }

    @Test
    void selfReferenceIsACycle() {
        var cycle = DependencyResolver.detectCycle(Map.of("a", Set.of("a")));
        assertEquals(List.of("a", "a"), cycle.orElseThrow());
    }

    @Test
    void unknownStepReferenceListsAvailableSteps() {
        var experiment = experiment("""
              - id: buffer
                primitive: roots/generate_buffers
                inputs:
                  parks: $steps.validat.out
              - id: validate
                primitive: soil/validate_vector
            """);

        var ex = assertThrows(GraphException.class, () -> new DependencyResolver(experiment).buildDependencyGraph());
        assertEquals(ErrorKind.UNKNOWN_STEP_REFERENCE, ex.kind());
        assertEquals("validat", ex.offendingValue());
        assertTrue(ex.getMessage().contains("Available steps: buffer, validate"));
    }

    @Test
    void findsReferencesNestedInParams() {
        assertEquals(Set.of("a", "b"), DependencyResolver.extractReferences(
            Map.of("list", List.of("$steps.a.out", Map.of("deep", "$steps.b.out")), "plain", "$choices.x")));

        var experiment = experiment("""
              - id: a
                primitive: roots/x
              - id: b
                primitive: roots/x
                params:
                  options:
                    - $steps.a.out
            """);
        assertEquals(Set.of("a"), new DependencyResolver(experiment).buildDependencyGraph().get("b"));
    }

    @Test
    void visualizesPlanInExecutionOrder() {
        var experiment = experiment("""
              - id: second
                primitive: roots/generate_buffers
                inputs:
                  parks: $steps.first.validated
                outputs:
                  buffers: park_buffers
              - id: first
                primitive: soil/validate_vector
                inputs:
                  data: $manifest.parks
                outputs:
                  validated: park_boundaries
            """);

        var text = new DependencyResolver(experiment).visualize();

        assertTrue(text.startsWith("Experiment: Graph test\nID: graph\nSteps: 2\n"));
        assertTrue(text.indexOf("1. first") < text.indexOf("2. second"));
        assertTrue(text.contains("<- (no dependencies, can run first)"));
        assertTrue(text.contains("<- depends on: first"));
        assertTrue(text.contains("outputs: buffers: park_buffers"));
    }

    private static Experiment experiment(String steps) {
        var yaml = """
            id: graph
            name: Graph test
            city: testville
            manifest: plots/testville/manifest.yml
            steps:
            """ + steps;
        return ExperimentParser.fromMap(YamlDocuments.parse(yaml, "graph.yml"), "graph.yml");
    }
}

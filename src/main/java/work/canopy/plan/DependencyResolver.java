package work.canopy.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import work.canopy.error.GraphException;
import work.canopy.model.Experiment;
import work.canopy.model.StepDefinition;
import work.canopy.reference.ReferenceParser;

/**
 * Derives the execution order of an experiment from its {@code $steps} references, never from declaration order.
 */
public final class DependencyResolver {
    private enum Mark { WHITE, GRAY, BLACK }

    private static final String RULE = "-".repeat(50);

    private final Experiment experiment;
    private final Map<String, StepDefinition> stepsById = new LinkedHashMap<>();

    public DependencyResolver(Experiment experiment) {
        this.experiment = Objects.requireNonNull(experiment, "experiment");
        for (var step : experiment.steps()) {
            stepsById.put(step.id(), step);
        }
    }

    public static Set<String> extractReferences(Object value) {
        var refs = new TreeSet<String>();
        collect(value, refs);
        return refs;
    }

    private static void collect(Object value, Set<String> refs) {
        if (value instanceof List<?> list) {
            list.forEach(item -> collect(item, refs));
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(item -> collect(item, refs));
        } else {
            ReferenceParser.stepReference(value).ifPresent(ref -> refs.add(ref.stepId()));
        }
    }

    /**
     * @throws GraphException if a step references a step id the experiment does not declare
     */
    public Map<String, Set<String>> buildDependencyGraph() {
        var graph = new LinkedHashMap<String, Set<String>>();
        var available = new ArrayList<>(new TreeSet<>(stepsById.keySet()));
        for (var step : experiment.steps()) {
            var dependencies = new TreeSet<String>();
            step.inputs().values().forEach(ref -> collect(ref, dependencies));
            step.params().values().forEach(value -> collect(value, dependencies));
            for (var dependency : dependencies) {
                if (!stepsById.containsKey(dependency)) {
                    throw GraphException.unknownStep(step.id(), dependency, available);
                }
            }
            graph.put(step.id(), dependencies);
        }
        return graph;
    }

    /**
     * Three-colour depth-first search. Returns the cycle with its first node repeated at the end.
     */
    public static Optional<List<String>> detectCycle(Map<String, Set<String>> graph) {
        var marks = new HashMap<String, Mark>();
        var parents = new HashMap<String, String>();
        graph.keySet().forEach(node -> marks.put(node, Mark.WHITE));
        for (var node : new TreeSet<>(graph.keySet())) {
            if (marks.get(node) == Mark.WHITE) {
                var cycle = visit(node, graph, marks, parents);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<List<String>> visit(String node, Map<String, Set<String>> graph, Map<String, Mark> marks, Map<String, String> parents) {
        marks.put(node, Mark.GRAY);
        for (var neighbour : new TreeSet<>(graph.getOrDefault(node, Set.of()))) {
            var mark = marks.getOrDefault(neighbour, Mark.BLACK);
            if (mark == Mark.GRAY) {
                var cycle = new ArrayList<String>();
                cycle.add(neighbour);
                for (var current = node; !current.equals(neighbour); current = parents.get(current)) {
                    cycle.add(current);
                }
                cycle.add(neighbour);
                Collections.reverse(cycle);
                return Optional.of(cycle);
            }
            if (mark == Mark.WHITE) {
                parents.put(neighbour, node);
                var cycle = visit(neighbour, graph, marks, parents);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }
        marks.put(node, Mark.BLACK);
        return Optional.empty();
    }

    /**
     * Kahn's algorithm with a lexicographically ordered ready queue.
     *
     * @throws GraphException if the graph contains a cycle; checked before sorting
     */
    public static List<String> topologicalSort(Map<String, Set<String>> graph) {
        var cycle = detectCycle(graph);
        if (cycle.isPresent()) {
            throw GraphException.cycle(cycle.get());
        }
        var inDegree = new HashMap<String, Integer>();
        var dependants = new HashMap<String, List<String>>();
        graph.forEach((node, deps) -> {
            inDegree.put(node, deps.size());
            deps.forEach(dep -> dependants.computeIfAbsent(dep, key -> new ArrayList<>()).add(node));
        });
        var ready = new PriorityQueue<String>();
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                ready.add(node);
            }
        });
        var order = new ArrayList<String>(graph.size());
        while (!ready.isEmpty()) {
            var node = ready.poll();
            order.add(node);
            for (var dependant : dependants.getOrDefault(node, List.of())) {
                if (inDegree.merge(dependant, -1, Integer::sum) == 0) {
                    ready.add(dependant);
                }
            }
        }
        if (order.size() != graph.size()) {
            var remaining = new TreeSet<>(graph.keySet());
            remaining.removeAll(order);
            throw new IllegalStateException("Topological sort incomplete; remaining steps: " + remaining);
        }
        return order;
    }

    public ExecutionPlan createExecutionPlan() {
        var graph = buildDependencyGraph();
        return new ExecutionPlan(topologicalSort(graph), graph);
    }

    public String visualize() {
        var plan = createExecutionPlan();
        var lines = new ArrayList<String>();
        lines.add("Experiment: " + experiment.name());
        lines.add("ID: " + experiment.id());
        lines.add("Steps: " + experiment.steps().size());
        lines.add("");
        lines.add("Execution Order:");
        lines.add(RULE);
        int index = 1;
        for (var stepId : plan.stepsInOrder()) {
            var step = stepsById.get(stepId);
            var deps = plan.dependenciesOf(stepId);
            lines.add("");
            lines.add("  " + index++ + ". " + stepId);
            lines.add("     primitive: " + step.primitive());
            lines.add(deps.isEmpty() ? "     <- (no dependencies, can run first)" : "     <- depends on: " + String.join(", ", deps));
            if (!step.inputs().isEmpty()) {
                lines.add("     inputs:");
                step.inputs().forEach((name, ref) -> lines.add("       " + name + ": " + ref));
            }
            if (!step.outputs().isEmpty()) {
                lines.add("     outputs: " + step.outputs().entrySet().stream()
                    .map(entry -> entry.getKey() + ": " + entry.getValue())
                    .collect(Collectors.joining(", ")));
            }
        }
        lines.add("");
        lines.add(RULE);
        return String.join("\n", lines);
    }
}

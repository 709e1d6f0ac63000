package work.canopy.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Deterministic execution order plus the dependency graph it was derived from.
 *
 * @param dependencyGraph step id to the ids of the steps it depends on
 */
public record ExecutionPlan(List<String> stepsInOrder, Map<String, Set<String>> dependencyGraph) {
    public ExecutionPlan {
        stepsInOrder = List.copyOf(stepsInOrder);
        var graph = new LinkedHashMap<String, Set<String>>();
        dependencyGraph.forEach((step, deps) -> graph.put(step, Collections.unmodifiableSet(new TreeSet<>(deps))));
        dependencyGraph = Collections.unmodifiableMap(graph);
    }

    public Set<String> dependenciesOf(String stepId) {
        return dependencyGraph.getOrDefault(stepId, Set.of());
    }

    public List<String> sinks() {
        var consumed = new TreeSet<String>();
        dependencyGraph.values().forEach(consumed::addAll);
        return stepsInOrder.stream().filter(step -> !consumed.contains(step)).toList();
    }
}

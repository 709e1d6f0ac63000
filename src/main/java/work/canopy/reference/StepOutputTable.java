package work.canopy.reference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class StepOutputTable {
    private final Map<String, Map<String, ResolvedInput>> outputs = new ConcurrentHashMap<>();

    public void register(String stepId, Map<String, ResolvedInput> stepOutputs) {
        var frozen = Collections.unmodifiableMap(new LinkedHashMap<>(stepOutputs));
        if (outputs.putIfAbsent(stepId, frozen) != null) {
            throw new IllegalStateException("Outputs of step '" + stepId + "' are already registered");
        }
    }

    public Optional<Map<String, ResolvedInput>> outputsOf(String stepId) {
        return Optional.ofNullable(outputs.get(stepId));
    }

    public boolean contains(String stepId) {
        return outputs.containsKey(stepId);
    }

    public Set<String> completedSteps() {
        return Collections.unmodifiableSet(new TreeSet<>(outputs.keySet()));
    }
}

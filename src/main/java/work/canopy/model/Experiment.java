package work.canopy.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.canopy.shared.Values;

public record Experiment(
    String id,
    String name,
    String description,
    Lineage lineage,
    String city,
    String manifestPath,
    Map<String, Object> choices,
    Map<String, Object> parameters,
    List<StepDefinition> steps
) {
    public Experiment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(lineage, "lineage");
        Objects.requireNonNull(city, "city");
        Objects.requireNonNull(manifestPath, "manifestPath");
        description = description == null ? "" : description;
        choices = Values.freezeMap(choices);
        parameters = Values.freezeMap(parameters);
        steps = List.copyOf(steps);
    }

    public Optional<StepDefinition> step(String stepId) {
        return steps.stream().filter(step -> step.id().equals(stepId)).findFirst();
    }

    public List<String> stepIds() {
        return steps.stream().map(StepDefinition::id).toList();
    }
}

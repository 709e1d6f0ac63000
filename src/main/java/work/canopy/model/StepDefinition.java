package work.canopy.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.canopy.shared.Values;

/**
 * One step of an experiment: a primitive invocation wired to its inputs, outputs and params.
 *
 * @param inputs input name to reference string
 * @param outputs output name to semantic type
 * @param params param name to arbitrary value, possibly containing references
 */
public record StepDefinition(
    String id,
    String primitive,
    String version,
    String description,
    Map<String, String> inputs,
    Map<String, String> outputs,
    Map<String, Object> params
) {
    public StepDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(primitive, "primitive");
        Objects.requireNonNull(version, "version");
        description = description == null ? "" : description;
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs == null ? Map.of() : inputs));
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs == null ? Map.of() : outputs));
        params = Values.freezeMap(params);
    }
}

package work.canopy.registry;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.canopy.shared.Values;

/**
 * A primitive's declaration in its layer registry.
 *
 * @param path file path relative to the layer directory
 * @param passthrough the primitive does not write its output; the envelope points at its input instead
 */
public record PrimitiveSpec(
    String name,
    String path,
    String version,
    List<Object> inputs,
    Map<String, Object> outputs,
    Map<String, Object> params,
    boolean passthrough
) {
    public PrimitiveSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(version, "version");
        @SuppressWarnings("unchecked")
        var frozenInputs = (List<Object>) Values.freeze(inputs == null ? List.of() : inputs);
        inputs = frozenInputs;
        outputs = Values.freezeMap(outputs);
        params = Values.freezeMap(params);
    }
}

package work.canopy.primitive;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.canopy.registry.ResolvedPrimitive;
import work.canopy.shared.Values;

public record PrimitiveInvocation(ResolvedPrimitive primitive, Map<String, Path> inputs, Path outputPath, Map<String, Object> params) {
    public PrimitiveInvocation {
        Objects.requireNonNull(primitive, "primitive");
        Objects.requireNonNull(outputPath, "outputPath");
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        params = Values.freezeMap(params);
    }
}

package work.canopy.envelope;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.canopy.registry.ResolvedPrimitive;
import work.canopy.shared.Values;

public record BuildRequest(
    ResolvedPrimitive primitive,
    String version,
    List<EnvelopeInput> inputs,
    Path outputPath,
    String outputFormat,
    String semanticType,
    String dataCategory,
    Map<String, Object> params
) {
    public BuildRequest {
        Objects.requireNonNull(primitive, "primitive");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(outputFormat, "outputFormat");
        Objects.requireNonNull(semanticType, "semanticType");
        Objects.requireNonNull(dataCategory, "dataCategory");
        inputs = List.copyOf(inputs);
        params = Values.freezeMap(params);
    }
}

package work.canopy.registry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import work.canopy.error.DocumentParseException;
import work.canopy.error.ErrorKind;
import work.canopy.error.ResolutionException;
import work.canopy.parse.YamlDocuments;
import work.canopy.shared.Values;

public final class RegistryLoader {
    public static final String REGISTRY_FILE = "_registry.yml";

    private RegistryLoader() {}

    public static Path location(Path projectRoot, Layer layer) {
        return projectRoot.resolve(layer.directory()).resolve(REGISTRY_FILE);
    }

    public static Map<String, PrimitiveSpec> load(Path projectRoot, Layer layer) {
        var path = location(projectRoot, layer);
        if (!Files.isRegularFile(path)) {
            throw new ResolutionException(ErrorKind.REGISTRY_NOT_FOUND, "Registry not found for layer '" + layer + "': " + path, layer.directory());
        }
        return fromMap(YamlDocuments.load(path), path.toString());
    }

    public static Map<String, PrimitiveSpec> fromMap(Map<String, Object> root, String source) {
        var specs = new LinkedHashMap<String, PrimitiveSpec>();
        for (var entry : Values.asMap(root.get("primitives")).entrySet()) {
            var name = entry.getKey();
            var data = Values.asMap(entry.getValue());
            var path = data.get("path");
            if (path == null || String.valueOf(path).isBlank()) {
                throw new DocumentParseException(ErrorKind.MISSING_FIELD, "Primitive '" + name + "' missing required field 'path' in " + source, source);
            }
            specs.put(name, new PrimitiveSpec(
                name,
                String.valueOf(path),
                Values.asString(data.get("version"), "1.0.0"),
                new ArrayList<>(Values.asList(data.get("inputs"))),
                Values.asMap(data.get("outputs")),
                Values.asMap(data.get("params")),
                Boolean.TRUE.equals(data.get("passthrough"))
            ));
        }
        return specs;
    }
}

package work.canopy.parse;

import static work.canopy.parse.YamlDocuments.optionalMap;
import static work.canopy.parse.YamlDocuments.optionalString;
import static work.canopy.parse.YamlDocuments.requireMap;
import static work.canopy.parse.YamlDocuments.requireString;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.canopy.error.DocumentParseException;
import work.canopy.error.ErrorKind;
import work.canopy.model.Manifest;
import work.canopy.model.ManifestDataset;

public final class ManifestParser {
    private ManifestParser() {}

    public static Manifest load(Path path) {
        var absolute = path.toAbsolutePath().normalize();
        var dataDirectory = absolute.getParent() == null ? absolute : absolute.getParent();
        return fromMap(YamlDocuments.load(path), path.toString(), dataDirectory);
    }

    public static Manifest fromMap(Map<String, Object> root, String source, Path dataDirectory) {
        var city = requireMap(root, "city", source);
        var crs = optionalMap(root, "crs", source);
        var datasets = new LinkedHashMap<String, ManifestDataset>();
        for (var entry : optionalMap(root, "datasets", source).entrySet()) {
            var name = entry.getKey();
            if (entry.getValue() != null && !(entry.getValue() instanceof Map<?, ?>)) {
                throw new DocumentParseException(ErrorKind.MALFORMED_DOCUMENT, "Dataset '" + name + "' must be a mapping in " + source, source);
            }
            @SuppressWarnings("unchecked")
            var data = entry.getValue() == null ? Map.<String, Object>of() : (Map<String, Object>) entry.getValue();
            if (Boolean.FALSE.equals(data.get("available"))) {
                continue;
            }
            var cache = optionalMap(data, "cache", source);
            datasets.put(name, new ManifestDataset(
                name,
                optionalString(cache, "path", ".data/" + name + ".geojson"),
                optionalString(data, "semantic_type", name),
                optionalString(data, "format", "geojson")
            ));
        }
        return new Manifest(
            requireString(city, "name", source + " city"),
            requireString(city, "id", source + " city"),
            Optional.ofNullable(crs.get("working")).map(String::valueOf),
            datasets,
            dataDirectory
        );
    }
}

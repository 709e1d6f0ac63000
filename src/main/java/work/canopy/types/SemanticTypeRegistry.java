package work.canopy.types;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.canopy.error.DocumentParseException;
import work.canopy.error.ErrorKind;
import work.canopy.error.ReferenceException;
import work.canopy.parse.YamlDocuments;
import work.canopy.shared.EditDistance;
import work.canopy.shared.Values;

public final class SemanticTypeRegistry {
    public static final String DEFAULT_LOCATION = "seeds/schemas/semantic_types.yml";
    private static final Set<String> KNOWN_FIELDS = Set.of("category", "format", "description");

    private final Map<String, SemanticType> types;

    public SemanticTypeRegistry(Map<String, SemanticType> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static SemanticTypeRegistry load(Path path) {
        return fromMap(YamlDocuments.load(path), path.toString());
    }

    public static SemanticTypeRegistry fromMap(Map<String, Object> root, String source) {
        var types = new LinkedHashMap<String, SemanticType>();
        for (var entry : Values.asMap(root.get("types")).entrySet()) {
            var name = entry.getKey();
            var data = Values.asMap(entry.getValue());
            var category = data.get("category");
            var format = data.get("format");
            if (category == null) {
                throw new DocumentParseException(ErrorKind.MISSING_FIELD, "Semantic type '" + name + "' missing required field 'category'", source);
            }
            if (format == null) {
                throw new DocumentParseException(ErrorKind.MISSING_FIELD, "Semantic type '" + name + "' missing required field 'format'", source);
            }
            var extra = new LinkedHashMap<String, Object>();
            data.forEach((key, value) -> {
                if (!KNOWN_FIELDS.contains(key)) {
                    extra.put(key, value);
                }
            });
            types.put(name, new SemanticType(
                name,
                String.valueOf(category),
                String.valueOf(format),
                Values.asString(data.get("description"), ""),
                extra
            ));
        }
        return new SemanticTypeRegistry(types);
    }

    public SemanticType get(String name) {
        var type = types.get(name);
        if (type != null) {
            return type;
        }
        var suggestions = suggest(name);
        var message = new StringBuilder("Unknown semantic type: '").append(name).append("'.");
        if (!suggestions.isEmpty()) {
            message.append(" Did you mean: ").append(String.join(", ", suggestions)).append('?');
        }
        message.append(" Valid types: ").append(String.join(", ", allTypes()));
        throw new ReferenceException(ErrorKind.UNKNOWN_SEMANTIC_TYPE, message.toString(), name, null, suggestions);
    }

    public String format(String name) {
        return get(name).format();
    }

    public String category(String name) {
        return get(name).category();
    }

    public boolean isValid(String name) {
        return types.containsKey(name);
    }

    public List<String> allTypes() {
        var names = new ArrayList<>(types.keySet());
        Collections.sort(names);
        return names;
    }

    public List<String> suggest(String name) {
        return EditDistance.closeMatches(name, types.keySet(), true);
    }
}

package work.canopy.types;

import java.util.Map;
import java.util.Objects;
import work.canopy.shared.Values;

public record SemanticType(String name, String category, String format, String description, Map<String, Object> extra) {
    public SemanticType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(format, "format");
        description = description == null ? "" : description;
        extra = Values.freezeMap(extra);
    }
}

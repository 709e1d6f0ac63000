package work.canopy.envelope;

import java.util.Map;
import java.util.Objects;
import work.canopy.shared.Values;

public record DataRef(String path, String format, Map<String, Object> secondary) {
    public DataRef {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(format, "format");
        secondary = Values.freezeMap(secondary);
    }
}

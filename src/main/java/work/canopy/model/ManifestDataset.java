package work.canopy.model;

import java.util.Objects;

/**
 * A dataset declared (and marked available) in a city manifest. {@code path} is relative to the manifest directory.
 */
public record ManifestDataset(String name, String path, String semanticType, String format) {
    public ManifestDataset {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(semanticType, "semanticType");
        Objects.requireNonNull(format, "format");
    }
}

package work.canopy.registry;

import java.nio.file.Path;

/**
 * A primitive reference resolved against its layer registry.
 *
 * @param relativePath {@code layer/spec.path}, relative to the project root
 * @param absolutePath the same path resolved against the project root
 */
public record ResolvedPrimitive(String reference, Layer layer, String relativePath, Path absolutePath, PrimitiveSpec spec) {
    public String shortName() {
        var fileName = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

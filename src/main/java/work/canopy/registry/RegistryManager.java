package work.canopy.registry;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import work.canopy.error.CanopyException;
import work.canopy.error.ErrorKind;
import work.canopy.error.ResolutionException;
import work.canopy.model.Experiment;
import work.canopy.shared.EditDistance;

public final class RegistryManager {
    private final RegistryCache cache;

    public RegistryManager(RegistryCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public ResolvedPrimitive resolve(String reference) {
        return resolve(reference, true);
    }

    public ResolvedPrimitive resolve(String reference, boolean verifyExists) {
        var parts = reference == null ? new String[0] : reference.split("/", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ResolutionException(
                ErrorKind.INVALID_PRIMITIVE_REFERENCE,
                "Invalid primitive reference: '" + reference + "'. Expected format: 'layer/primitive_name' (e.g. 'roots/generate_buffers')",
                reference
            );
        }
        var layer = Layer.fromName(parts[0]).orElseThrow(() -> new ResolutionException(
            ErrorKind.UNKNOWN_LAYER,
            "Unknown layer: '" + parts[0] + "'. Must be one of: " + String.join(", ", layerNames()),
            reference,
            EditDistance.closeMatches(parts[0], layerNames())
        ));

        var registry = cache.layer(layer);
        var spec = registry.get(parts[1]);
        if (spec == null) {
            var available = new TreeSet<>(registry.keySet());
            throw new ResolutionException(
                ErrorKind.UNKNOWN_PRIMITIVE,
                "Primitive '" + parts[1] + "' not found in " + layer + "/" + RegistryLoader.REGISTRY_FILE + ". Available: " + String.join(", ", available),
                reference,
                EditDistance.closeMatches(parts[1], available)
            );
        }

        var relativePath = layer.directory() + "/" + spec.path();
        var absolutePath = cache.projectRoot().resolve(relativePath).normalize();
        if (verifyExists && !Files.exists(absolutePath)) {
            throw new ResolutionException(
                ErrorKind.PRIMITIVE_FILE_MISSING,
                "Primitive file not found: " + absolutePath + ". Registry entry '" + parts[1] + "' in " + layer + "/" + RegistryLoader.REGISTRY_FILE
                    + " points to '" + spec.path() + "', but the file does not exist.",
                reference
            );
        }
        return new ResolvedPrimitive(reference, layer, relativePath, absolutePath, spec);
    }

    public PrimitiveSpec spec(String reference) {
        return resolve(reference).spec();
    }

    public String path(String reference) {
        return resolve(reference).relativePath();
    }

    public List<String> validateAllPrimitives(Experiment experiment, boolean verifyExists) {
        var errors = new ArrayList<String>();
        for (var step : experiment.steps()) {
            try {
                resolve(step.primitive(), verifyExists);
            } catch (CanopyException ex) {
                errors.add("Step '" + step.id() + "': " + ex.getMessage());
            }
        }
        return errors;
    }

    private static List<String> layerNames() {
        return Arrays.stream(Layer.values()).map(Layer::directory).toList();
    }
}

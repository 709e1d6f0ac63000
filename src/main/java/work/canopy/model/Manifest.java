package work.canopy.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed city manifest. Only datasets marked available are present.
 */
public record Manifest(String cityName, String cityId, Optional<String> workingCrs, Map<String, ManifestDataset> datasets, Path dataDirectory) {
    public Manifest {
        Objects.requireNonNull(cityName, "cityName");
        Objects.requireNonNull(cityId, "cityId");
        Objects.requireNonNull(workingCrs, "workingCrs");
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        datasets = Collections.unmodifiableMap(new LinkedHashMap<>(datasets));
    }

    public Optional<ManifestDataset> dataset(String name) {
        return Optional.ofNullable(datasets.get(name));
    }

    public Path resolve(ManifestDataset dataset) {
        return dataDirectory.resolve(dataset.path()).normalize();
    }
}

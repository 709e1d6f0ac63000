package work.canopy.registry;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-layer registry cache. Each layer document is loaded at most once for the lifetime of the cache.
 */
public final class RegistryCache {
    private static final Logger LOG = LoggerFactory.getLogger(RegistryCache.class);

    private final Path projectRoot;
    private final Map<Layer, Map<String, PrimitiveSpec>> layers = new ConcurrentHashMap<>();
    private final AtomicInteger loads = new AtomicInteger();

    public RegistryCache(Path projectRoot) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public Map<String, PrimitiveSpec> layer(Layer layer) {
        return layers.computeIfAbsent(layer, key -> {
            var specs = RegistryLoader.load(projectRoot, key);
            loads.incrementAndGet();
            LOG.debug("Loaded {} primitives from {}", specs.size(), RegistryLoader.location(projectRoot, key));
            return Map.copyOf(specs);
        });
    }

    public int loadCount() {
        return loads.get();
    }
}

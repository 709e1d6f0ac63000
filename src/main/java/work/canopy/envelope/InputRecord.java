package work.canopy.envelope;

import java.util.Objects;

public record InputRecord(String name, String semanticType, String path, HashInfo hash) {
    public InputRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(semanticType, "semanticType");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(hash, "hash");
    }
}

package work.canopy.envelope;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.canopy.shared.Values;

public record Envelope(DataRef data, Map<String, Object> metadata, List<ProvenanceEntry> provenance, List<Warning> warnings) {
    public static final String SEMANTIC_TYPE = "semantic_type";
    public static final String DATA_CATEGORY = "data_category";
    public static final String LINEAGE = "lineage";

    public Envelope {
        Objects.requireNonNull(data, "data");
        metadata = Values.freezeMap(metadata);
        provenance = List.copyOf(provenance);
        warnings = List.copyOf(warnings);
    }

    public String semanticType() {
        return Values.asString(metadata.get(SEMANTIC_TYPE), "");
    }

    public Optional<ProvenanceEntry> latestProvenance() {
        return provenance.isEmpty() ? Optional.empty() : Optional.of(provenance.get(provenance.size() - 1));
    }

    /**
     * Copy with {@code metadata.lineage} set; only applied to final (sink) envelopes.
     */
    public Envelope withLineage(Map<String, Object> lineage) {
        var updated = Values.copyMap(metadata);
        updated.put(LINEAGE, Values.copyMap(lineage));
        return new Envelope(data, updated, provenance, warnings);
    }
}

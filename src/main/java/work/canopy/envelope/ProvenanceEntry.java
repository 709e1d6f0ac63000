package work.canopy.envelope;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.canopy.shared.Values;

/**
 * One primitive invocation in an artifact's history.
 *
 * @param lineageBranch name of the input through which this entry was inherited; empty for the entry of the step
 *                      that produced the envelope
 */
public record ProvenanceEntry(
    String primitive,
    String version,
    String timestamp,
    Map<String, Object> params,
    List<InputRecord> inputs,
    double durationSeconds,
    Optional<String> lineageBranch
) {
    public ProvenanceEntry {
        Objects.requireNonNull(primitive, "primitive");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(lineageBranch, "lineageBranch");
        params = Values.freezeMap(params);
        inputs = List.copyOf(inputs);
    }

    /**
     * Tags the entry with {@code branch} unless it already carries a branch; the first tag wins.
     */
    public ProvenanceEntry inheritedThrough(String branch) {
        if (lineageBranch.isPresent()) {
            return this;
        }
        return new ProvenanceEntry(primitive, version, timestamp, params, inputs, durationSeconds, Optional.of(branch));
    }
}

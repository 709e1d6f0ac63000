package work.canopy.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.canopy.shared.Values;

public record Lineage(String curiosityRef, Optional<String> subQuestion, String methodRef, Map<String, Object> choices) {
    public Lineage {
        Objects.requireNonNull(curiosityRef, "curiosityRef");
        Objects.requireNonNull(subQuestion, "subQuestion");
        Objects.requireNonNull(methodRef, "methodRef");
        choices = Values.freezeMap(choices);
    }

    /**
     * The {@code metadata.lineage} block attached to sink envelopes.
     */
    public Map<String, Object> toMetadata(Map<String, Object> parameters) {
        var block = new LinkedHashMap<String, Object>();
        block.put("curiosity", curiosityRef);
        block.put("sub_question", subQuestion.orElse(null));
        block.put("method", methodRef);
        block.put("choices", Values.copy(choices));
        block.put("parameters", Values.copyMap(parameters));
        return block;
    }
}

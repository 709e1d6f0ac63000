package work.canopy.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public record MethodChoice(String name, List<Object> options, String description) {
    public MethodChoice {
        Objects.requireNonNull(name, "name");
        options = options == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(options));
        description = description == null ? "" : description;
    }
}

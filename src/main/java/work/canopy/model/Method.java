package work.canopy.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Method(String id, String name, Map<String, MethodChoice> choices) {
    public Method {
        choices = Collections.unmodifiableMap(new LinkedHashMap<>(choices));
    }
}

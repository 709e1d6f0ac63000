package work.canopy.envelope;

import java.util.Objects;

public record Warning(String level, String primitive, String message) {
    public static final String INFO = "info";
    public static final String WARNING = "warning";
    public static final String CRITICAL = "critical";

    public Warning {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(primitive, "primitive");
        Objects.requireNonNull(message, "message");
    }
}

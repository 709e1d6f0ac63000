package work.canopy.error;

import java.util.List;

public final class GraphException extends CanopyException {
    private final List<String> cycle;

    private GraphException(ErrorKind kind, String message, String offendingValue, String context, List<String> suggestions, List<String> cycle) {
        super(kind, message, offendingValue, context, suggestions, null);
        this.cycle = cycle == null ? List.of() : List.copyOf(cycle);
    }

    public static GraphException unknownStep(String stepId, String referencedId, List<String> available) {
        return new GraphException(
            ErrorKind.UNKNOWN_STEP_REFERENCE,
            "Step '" + stepId + "' references unknown step '" + referencedId + "'. Available steps: " + String.join(", ", available),
            referencedId,
            "step '" + stepId + "'",
            available,
            List.of()
        );
    }

    public static GraphException cycle(List<String> cycle) {
        return new GraphException(
            ErrorKind.DEPENDENCY_CYCLE,
            "Circular dependency detected in experiment steps: " + String.join(" -> ", cycle)
                + ". Each step in this cycle depends on another step in the cycle; restructure the experiment to break the loop.",
            String.join(" -> ", cycle),
            null,
            List.of(),
            cycle
        );
    }

    /**
     * Ordered cycle, first element repeated at the end. Empty unless {@link #kind()} is a cycle.
     */
    public List<String> cycle() {
        return cycle;
    }
}

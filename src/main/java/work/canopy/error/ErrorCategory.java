package work.canopy.error;

public enum ErrorCategory {
    STRUCTURAL_PARSE,
    GRAPH,
    REFERENCE,
    RESOLUTION,
    PRIMITIVE_EXECUTION,
    ENVELOPE_VALIDATION
}

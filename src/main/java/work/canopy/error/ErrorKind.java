package work.canopy.error;

public enum ErrorKind {
    MALFORMED_DOCUMENT(ErrorCategory.STRUCTURAL_PARSE),
    MISSING_FIELD(ErrorCategory.STRUCTURAL_PARSE),
    DUPLICATE_STEP_ID(ErrorCategory.STRUCTURAL_PARSE),

    UNKNOWN_STEP_REFERENCE(ErrorCategory.GRAPH),
    DEPENDENCY_CYCLE(ErrorCategory.GRAPH),

    MALFORMED_REFERENCE(ErrorCategory.REFERENCE),
    EMBEDDED_REFERENCE(ErrorCategory.REFERENCE),
    MISPLACED_REFERENCE(ErrorCategory.REFERENCE),
    UNKNOWN_CHOICE(ErrorCategory.REFERENCE),
    UNKNOWN_PARAMETER(ErrorCategory.REFERENCE),
    UNKNOWN_DATASET(ErrorCategory.REFERENCE),
    DATASET_FILE_MISSING(ErrorCategory.REFERENCE),
    UNKNOWN_STEP(ErrorCategory.REFERENCE),
    STEP_NOT_EXECUTED(ErrorCategory.REFERENCE),
    UNKNOWN_STEP_OUTPUT(ErrorCategory.REFERENCE),
    UNKNOWN_SEMANTIC_TYPE(ErrorCategory.REFERENCE),

    INVALID_PRIMITIVE_REFERENCE(ErrorCategory.RESOLUTION),
    UNKNOWN_LAYER(ErrorCategory.RESOLUTION),
    REGISTRY_NOT_FOUND(ErrorCategory.RESOLUTION),
    UNKNOWN_PRIMITIVE(ErrorCategory.RESOLUTION),
    PRIMITIVE_FILE_MISSING(ErrorCategory.RESOLUTION),

    PRIMITIVE_INVALID_OUTPUT(ErrorCategory.PRIMITIVE_EXECUTION),
    PRIMITIVE_FAILED(ErrorCategory.PRIMITIVE_EXECUTION),
    PRIMITIVE_TIMEOUT(ErrorCategory.PRIMITIVE_EXECUTION),
    PRIMITIVE_LAUNCH_FAILED(ErrorCategory.PRIMITIVE_EXECUTION),

    ENVELOPE_INVALID(ErrorCategory.ENVELOPE_VALIDATION);

    private final ErrorCategory category;

    ErrorKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}

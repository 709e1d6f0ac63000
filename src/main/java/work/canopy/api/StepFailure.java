package work.canopy.api;

public enum StepFailure {
    PRIMITIVE_RESOLUTION("Primitive resolution failed"),
    INPUT_RESOLUTION("Input resolution failed"),
    PARAMETER_RESOLUTION("Parameter resolution failed"),
    INVALID_STEP("Invalid step definition"),
    PRIMITIVE_EXECUTION("Primitive execution failed"),
    ENVELOPE_WRITE("Envelope write failed");

    private final String label;

    StepFailure(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

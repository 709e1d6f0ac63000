package work.canopy.reference;

import java.util.Objects;

/**
 * A raw string or value parsed once into one of the reference forms understood by the engine.
 */
public sealed interface Reference {
    String MANIFEST = "$manifest.";
    String CHOICES = "$choices.";
    String PARAMETERS = "$parameters.";
    String STEPS = "$steps.";

    boolean isDataReference();

    boolean isValueReference();

    record ManifestRef(String dataset) implements Reference {
        public ManifestRef {
            Objects.requireNonNull(dataset, "dataset");
        }

        @Override
        public boolean isDataReference() {
            return true;
        }

        @Override
        public boolean isValueReference() {
            return false;
        }

        @Override
        public String toString() {
            return MANIFEST + dataset;
        }
    }

    record ChoiceRef(String name) implements Reference {
        public ChoiceRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean isDataReference() {
            return false;
        }

        @Override
        public boolean isValueReference() {
            return true;
        }

        @Override
        public String toString() {
            return CHOICES + name;
        }
    }

    record ParameterRef(String name) implements Reference {
        public ParameterRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean isDataReference() {
            return false;
        }

        @Override
        public boolean isValueReference() {
            return true;
        }

        @Override
        public String toString() {
            return PARAMETERS + name;
        }
    }

    record StepRef(String stepId, String output) implements Reference {
        public StepRef {
            Objects.requireNonNull(stepId, "stepId");
            Objects.requireNonNull(output, "output");
        }

        @Override
        public boolean isDataReference() {
            return true;
        }

        @Override
        public boolean isValueReference() {
            return false;
        }

        @Override
        public String toString() {
            return STEPS + stepId + "." + output;
        }
    }

    record Literal(Object value) implements Reference {
        @Override
        public boolean isDataReference() {
            return false;
        }

        @Override
        public boolean isValueReference() {
            return false;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }
}

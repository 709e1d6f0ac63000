package work.canopy.envelope;

import java.util.Locale;

/**
 * Hashing profile applied to every input file before a primitive runs.
 */
public enum HashProfile {
    FULL,
    /** Fast hash over size, modification time and a bounded prefix. */
    DEV,
    TEST;

    public static HashProfile from(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        try {
            return HashProfile.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported profile: " + value + " (expected full, dev or test)");
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package work.canopy.envelope;

import java.util.Arrays;

public enum HashMethod {
    FULL_FILE("full_file"),
    METADATA("metadata"),
    SKIPPED("skipped");

    private final String wireName;

    HashMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static HashMethod fromWireName(String value) {
        return Arrays.stream(values())
            .filter(method -> method.wireName.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown hash method: " + value));
    }
}

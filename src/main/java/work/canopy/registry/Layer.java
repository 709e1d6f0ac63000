package work.canopy.registry;

import java.util.Arrays;
import java.util.Optional;

public enum Layer {
    ROOTS("roots"),
    SOIL("soil");

    private final String directory;

    Layer(String directory) {
        this.directory = directory;
    }

    public String directory() {
        return directory;
    }

    public static Optional<Layer> fromName(String name) {
        return Arrays.stream(values()).filter(layer -> layer.directory.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return directory;
    }
}

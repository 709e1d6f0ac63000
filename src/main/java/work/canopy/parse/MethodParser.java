package work.canopy.parse;

import static work.canopy.parse.YamlDocuments.optionalMap;
import static work.canopy.parse.YamlDocuments.optionalString;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import work.canopy.model.Method;
import work.canopy.model.MethodChoice;
import work.canopy.shared.Values;

/**
 * Parses method documents; {@code id} and {@code name} default to the file stem.
 */
public final class MethodParser {
    private MethodParser() {}

    public static Method load(Path path) {
        var source = path.toString();
        var root = YamlDocuments.load(path);
        var fileName = path.getFileName().toString();
        var stem = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;

        var choices = new LinkedHashMap<String, MethodChoice>();
        for (var entry : optionalMap(root, "choices", source).entrySet()) {
            var choice = Values.asMap(entry.getValue());
            choices.put(entry.getKey(), new MethodChoice(
                entry.getKey(),
                new ArrayList<>(Values.asList(choice.get("options"))),
                optionalString(choice, "description", "")
            ));
        }
        return new Method(optionalString(root, "id", stem), optionalString(root, "name", stem), choices);
    }
}

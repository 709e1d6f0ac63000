package work.canopy.parse;

import static work.canopy.parse.YamlDocuments.optionalMap;
import static work.canopy.parse.YamlDocuments.optionalString;
import static work.canopy.parse.YamlDocuments.requireString;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.canopy.error.DocumentParseException;
import work.canopy.error.ErrorKind;
import work.canopy.model.Experiment;
import work.canopy.model.Lineage;
import work.canopy.model.StepDefinition;

public final class ExperimentParser {
    static final String DEFAULT_STEP_VERSION = "1.0.0";

    private ExperimentParser() {}

    public static Experiment load(Path path) {
        return fromMap(YamlDocuments.load(path), path.toString());
    }

    public static Experiment fromMap(Map<String, Object> root, String source) {
        var curiosity = optionalMap(root, "curiosity", source);
        var method = optionalMap(root, "method", source);
        var choices = optionalMap(root, "choices", source);
        var parameters = optionalMap(root, "parameters", source);

        var lineage = new Lineage(
            optionalString(curiosity, "ref", ""),
            Optional.ofNullable(curiosity.get("sub_question")).map(String::valueOf),
            optionalString(method, "ref", ""),
            choices
        );

        return new Experiment(
            requireString(root, "id", source),
            requireString(root, "name", source),
            optionalString(root, "description", ""),
            lineage,
            requireString(root, "city", source),
            requireString(root, "manifest", source),
            choices,
            parameters,
            parseSteps(root.get("steps"), source)
        );
    }

    private static List<StepDefinition> parseSteps(Object raw, String source) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new DocumentParseException(ErrorKind.MALFORMED_DOCUMENT, "'steps' must be a list in " + source, source);
        }
        var steps = new ArrayList<StepDefinition>();
        var seen = new HashSet<String>();
        for (int index = 0; index < list.size(); index++) {
            var context = source + " steps[" + index + "]";
            if (!(list.get(index) instanceof Map<?, ?>)) {
                throw new DocumentParseException(ErrorKind.MALFORMED_DOCUMENT, "Step must be a mapping: " + context, context);
            }
            @SuppressWarnings("unchecked")
            var stepMap = (Map<String, Object>) list.get(index);
            var id = requireString(stepMap, "id", context);
            if (!seen.add(id)) {
                throw new DocumentParseException(ErrorKind.DUPLICATE_STEP_ID, "Duplicate step id '" + id + "' in " + source, context);
            }
            steps.add(new StepDefinition(
                id,
                requireString(stepMap, "primitive", context),
                optionalString(stepMap, "version", DEFAULT_STEP_VERSION),
                optionalString(stepMap, "description", ""),
                stringMap(optionalMap(stepMap, "inputs", context), "inputs", context),
                stringMap(optionalMap(stepMap, "outputs", context), "outputs", context),
                optionalMap(stepMap, "params", context)
            ));
        }
        return steps;
    }

    private static Map<String, String> stringMap(Map<String, Object> raw, String field, String context) {
        var result = new LinkedHashMap<String, String>();
        for (var entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof String value)) {
                throw new DocumentParseException(
                    ErrorKind.MALFORMED_DOCUMENT,
                    "Field '" + field + "." + entry.getKey() + "' must be a string in " + context,
                    context
                );
            }
            result.put(entry.getKey(), value);
        }
        return result;
    }
}

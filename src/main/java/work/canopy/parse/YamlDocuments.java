package work.canopy.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.canopy.error.DocumentParseException;
import work.canopy.error.ErrorKind;
import work.canopy.shared.Values;

/**
 * Loads YAML documents into the plain value universe (ordered maps, lists, scalars).
 */
public final class YamlDocuments {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
    );

    private YamlDocuments() {}

    public static ObjectMapper mapper() {
        return YAML_MAPPER;
    }

    public static Map<String, Object> load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return rootObject(YAML_MAPPER.readTree(in), path.toString());
        } catch (NoSuchFileException ex) {
            throw new DocumentParseException("Document not found: " + path, path.toString(), ex);
        } catch (JsonProcessingException ex) {
            throw new DocumentParseException("Malformed YAML in " + path + ": " + ex.getOriginalMessage(), path.toString(), ex);
        } catch (IOException ex) {
            throw new DocumentParseException("Failed to read " + path + ": " + ex.getMessage(), path.toString(), ex);
        }
    }

    public static Map<String, Object> parse(String yaml, String source) {
        try {
            return rootObject(YAML_MAPPER.readTree(yaml), source);
        } catch (JsonProcessingException ex) {
            throw new DocumentParseException("Malformed YAML in " + source + ": " + ex.getOriginalMessage(), source, ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> rootObject(JsonNode root, String source) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new LinkedHashMap<>();
        }
        if (!root.isObject()) {
            throw new DocumentParseException(ErrorKind.MALFORMED_DOCUMENT, "Document root must be a mapping: " + source, source);
        }
        return (Map<String, Object>) convertNode(root);
    }

    public static Object convertNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return Values.number(node.numberValue());
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    static Map<String, Object> requireMap(Map<String, Object> parent, String key, String source) {
        var value = parent.get(key);
        if (!(value instanceof Map<?, ?>)) {
            throw new DocumentParseException(ErrorKind.MISSING_FIELD, "Missing or invalid mapping '" + key + "' in " + source, source);
        }
        return Values.asMap(value);
    }

    static Map<String, Object> optionalMap(Map<String, Object> parent, String key, String source) {
        var value = parent.get(key);
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new DocumentParseException(ErrorKind.MALFORMED_DOCUMENT, "Field '" + key + "' must be a mapping in " + source, source);
        }
        return Values.asMap(value);
    }

    static String requireString(Map<String, Object> parent, String key, String source) {
        var value = parent.get(key);
        if (value == null || (value instanceof Map<?, ?>) || (value instanceof List<?>) || String.valueOf(value).isBlank()) {
            throw new DocumentParseException(ErrorKind.MISSING_FIELD, "Missing required field '" + key + "' in " + source, source);
        }
        return String.valueOf(value);
    }

    static String optionalString(Map<String, Object> parent, String key, String fallback) {
        var value = parent.get(key);
        return value == null ? fallback : String.valueOf(value);
    }
}

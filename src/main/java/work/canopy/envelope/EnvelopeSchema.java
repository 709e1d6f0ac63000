package work.canopy.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Compiled canonical envelope schema. Load once and share; validation is thread-safe.
 */
public final class EnvelopeSchema {
    public static final String BUNDLED_RESOURCE = "/schemas/envelope.schema.json";
    public static final String PROJECT_LOCATION = "seeds/schemas/envelope.schema.json";
    private static final ObjectMapper JSON = new ObjectMapper();

    private final JsonSchema schema;
    private final String source;

    private EnvelopeSchema(JsonNode schemaNode, String source) {
        this.schema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
        this.source = source;
    }

    public static EnvelopeSchema bundled() {
        try (InputStream in = EnvelopeSchema.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled envelope schema missing: " + BUNDLED_RESOURCE);
            }
            return new EnvelopeSchema(JSON.readTree(in), "classpath:" + BUNDLED_RESOURCE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load bundled envelope schema", ex);
        }
    }

    public static EnvelopeSchema load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return new EnvelopeSchema(JSON.readTree(in), path.toString());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load envelope schema " + path, ex);
        }
    }

    public static EnvelopeSchema forProject(Path projectRoot) {
        var candidate = projectRoot.resolve(PROJECT_LOCATION);
        return Files.isRegularFile(candidate) ? load(candidate) : bundled();
    }

    public String source() {
        return source;
    }

    public List<String> validate(Map<String, Object> document) {
        JsonNode node = JSON.valueToTree(document);
        return schema.validate(node).stream()
            .map(ValidationMessage::getMessage)
            .sorted(Comparator.naturalOrder())
            .toList();
    }
}

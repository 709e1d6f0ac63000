package work.canopy.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.canopy.error.DocumentParseException;
import work.canopy.error.EnvelopeValidationException;
import work.canopy.error.ErrorKind;
import work.canopy.parse.YamlDocuments;
import work.canopy.shared.Values;

/**
 * Converts envelopes to and from their canonical JSON document form. Writes are schema-checked and fail hard;
 * reads are schema-checked but only warn.
 */
public final class EnvelopeCodec {
    private static final Logger LOG = LoggerFactory.getLogger(EnvelopeCodec.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON.writerWithDefaultPrettyPrinter();

    private final EnvelopeSchema schema;

    public EnvelopeCodec(EnvelopeSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public EnvelopeSchema schema() {
        return schema;
    }

    public void write(Envelope envelope, Path path) {
        var document = toDocument(envelope);
        var violations = schema.validate(document);
        if (!violations.isEmpty()) {
            throw new EnvelopeValidationException(path.toString(), violations);
        }
        try {
            var parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            var temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try {
                WRITER.writeValue(temp.toFile(), document);
                moveIntoPlace(temp, path);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write envelope " + path, ex);
        }
    }

    public ReadResult read(Path path) {
        Map<String, Object> document;
        try (var in = Files.newInputStream(path)) {
            var parsed = YamlDocuments.convertNode(JSON.readTree(in));
            if (!(parsed instanceof Map<?, ?>)) {
                throw new DocumentParseException(ErrorKind.MALFORMED_DOCUMENT, "Envelope root must be an object: " + path, path.toString());
            }
            document = Values.asMap(parsed);
        } catch (IOException ex) {
            throw new DocumentParseException("Failed to read envelope " + path + ": " + ex.getMessage(), path.toString(), ex);
        }
        var violations = schema.validate(document);
        if (!violations.isEmpty()) {
            LOG.warn("Envelope at {} has validation issues: {}", path, violations);
        }
        return new ReadResult(fromDocument(document, path.toString()), violations);
    }

    public static Map<String, Object> toDocument(Envelope envelope) {
        var data = new LinkedHashMap<String, Object>();
        data.put("path", envelope.data().path());
        data.put("format", envelope.data().format());
        data.put("secondary", Values.copyMap(envelope.data().secondary()));

        var provenance = new ArrayList<Object>();
        for (var entry : envelope.provenance()) {
            var inputs = new ArrayList<Object>();
            for (var input : entry.inputs()) {
                var record = new LinkedHashMap<String, Object>();
                record.put("name", input.name());
                record.put("semantic_type", input.semanticType());
                record.put("path", input.path());
                record.put("hash", hashDocument(input.hash()));
                inputs.add(record);
            }
            var item = new LinkedHashMap<String, Object>();
            item.put("primitive", entry.primitive());
            item.put("version", entry.version());
            item.put("timestamp", entry.timestamp());
            item.put("params", Values.copyMap(entry.params()));
            item.put("inputs", inputs);
            item.put("duration_seconds", entry.durationSeconds());
            item.put("lineage_branch", entry.lineageBranch().orElse(null));
            provenance.add(item);
        }

        var warnings = new ArrayList<Object>();
        for (var warning : envelope.warnings()) {
            var item = new LinkedHashMap<String, Object>();
            item.put("level", warning.level());
            item.put("primitive", warning.primitive());
            item.put("message", warning.message());
            warnings.add(item);
        }

        var document = new LinkedHashMap<String, Object>();
        document.put("data", data);
        document.put("metadata", Values.copyMap(envelope.metadata()));
        document.put("provenance", provenance);
        document.put("warnings", warnings);
        return document;
    }

    public static Envelope fromDocument(Map<String, Object> document, String source) {
        var data = requireObject(document, "data", source);
        var provenance = new ArrayList<ProvenanceEntry>();
        for (var raw : Values.asList(document.get("provenance"))) {
            var entry = Values.asMap(raw);
            var inputs = new ArrayList<InputRecord>();
            for (var rawInput : Values.asList(entry.get("inputs"))) {
                var input = Values.asMap(rawInput);
                inputs.add(new InputRecord(
                    text(input, "name", source),
                    text(input, "semantic_type", source),
                    text(input, "path", source),
                    hashFromDocument(requireObject(input, "hash", source), source)
                ));
            }
            provenance.add(new ProvenanceEntry(
                text(entry, "primitive", source),
                text(entry, "version", source),
                text(entry, "timestamp", source),
                Values.asMap(entry.get("params")),
                inputs,
                entry.get("duration_seconds") instanceof Number number ? number.doubleValue() : 0.0,
                Optional.ofNullable(entry.get("lineage_branch")).map(String::valueOf)
            ));
        }
        var warnings = new ArrayList<Warning>();
        for (var raw : Values.asList(document.get("warnings"))) {
            var warning = Values.asMap(raw);
            warnings.add(new Warning(text(warning, "level", source), text(warning, "primitive", source), text(warning, "message", source)));
        }
        return new Envelope(
            new DataRef(text(data, "path", source), text(data, "format", source), Values.asMap(data.get("secondary"))),
            Values.asMap(document.get("metadata")),
            provenance,
            warnings
        );
    }

    private static Map<String, Object> hashDocument(HashInfo hash) {
        var document = new LinkedHashMap<String, Object>();
        hash.value().ifPresent(value -> document.put("value", value));
        document.put("method", hash.method().wireName());
        hash.algorithm().ifPresent(value -> document.put("algorithm", value));
        hash.reason().ifPresent(value -> document.put("reason", value));
        return document;
    }

    private static HashInfo hashFromDocument(Map<String, Object> hash, String source) {
        HashMethod method;
        try {
            method = HashMethod.fromWireName(text(hash, "method", source));
        } catch (IllegalArgumentException ex) {
            throw new DocumentParseException(ex.getMessage() + " in " + source, source, ex);
        }
        return new HashInfo(
            Optional.ofNullable(hash.get("value")).map(String::valueOf),
            method,
            Optional.ofNullable(hash.get("algorithm")).map(String::valueOf),
            Optional.ofNullable(hash.get("reason")).map(String::valueOf)
        );
    }

    private static Map<String, Object> requireObject(Map<String, Object> parent, String key, String source) {
        if (!(parent.get(key) instanceof Map<?, ?>)) {
            throw new DocumentParseException(ErrorKind.MISSING_FIELD, "Envelope field '" + key + "' missing or not an object in " + source, source);
        }
        return Values.asMap(parent.get(key));
    }

    private static String text(Map<String, Object> parent, String key, String source) {
        var value = parent.get(key);
        if (value == null) {
            throw new DocumentParseException(ErrorKind.MISSING_FIELD, "Envelope field '" + key + "' missing in " + source, source);
        }
        return String.valueOf(value);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public record ReadResult(Envelope envelope, List<String> violations) {
        public ReadResult {
            violations = List.copyOf(violations);
        }

        public boolean valid() {
            return violations.isEmpty();
        }
    }
}

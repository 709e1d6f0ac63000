package work.canopy.envelope;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.canopy.primitive.PrimitiveExecutor;
import work.canopy.primitive.PrimitiveInvocation;
import work.canopy.primitive.PrimitiveOutcome;
import work.canopy.shared.Values;

/**
 * Runs a primitive and wraps its output into an {@link Envelope}, merging the provenance and warnings of every
 * input envelope.
 */
public final class EnvelopeBuilder {
    private static final String[] TRANSPORT_FIELDS = {"warnings", "status"};

    private final Hasher hasher;
    private final PrimitiveExecutor executor;
    private final Clock clock;

    public EnvelopeBuilder(Hasher hasher, PrimitiveExecutor executor) {
        this(hasher, executor, Clock.systemUTC());
    }

    public EnvelopeBuilder(Hasher hasher, PrimitiveExecutor executor, Clock clock) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BuildResult build(BuildRequest request) {
        var inputRecords = new ArrayList<InputRecord>();
        var inputPaths = new LinkedHashMap<String, Path>();
        for (var input : request.inputs()) {
            inputRecords.add(new InputRecord(input.name(), input.semanticType(), input.path().toString(), hasher.hash(input.path())));
            inputPaths.put(input.name(), input.path());
        }

        long started = System.nanoTime();
        var outcome = executor.execute(new PrimitiveInvocation(request.primitive(), inputPaths, request.outputPath(), request.params()));
        double elapsed = (System.nanoTime() - started) / 1_000_000_000.0;
        if (!outcome.success()) {
            return new BuildResult(Optional.empty(), outcome);
        }

        var shortName = request.primitive().shortName();
        var entry = new ProvenanceEntry(
            shortName,
            request.version(),
            Instant.now(clock).toString(),
            request.params(),
            inputRecords,
            Math.round(elapsed * 1000.0) / 1000.0,
            Optional.empty()
        );
        var envelope = new Envelope(
            new DataRef(dataPath(request), request.outputFormat(), Map.of()),
            metadata(outcome, request.semanticType(), request.dataCategory()),
            mergeProvenance(request.inputs(), entry),
            mergeWarnings(request.inputs(), outcome, shortName)
        );
        return new BuildResult(Optional.of(envelope), outcome);
    }

    static List<ProvenanceEntry> mergeProvenance(List<EnvelopeInput> inputs, ProvenanceEntry own) {
        var merged = new ArrayList<ProvenanceEntry>();
        for (var input : inputs) {
            input.envelope().ifPresent(envelope -> {
                for (var inherited : envelope.provenance()) {
                    merged.add(inherited.inheritedThrough(input.name()));
                }
            });
        }
        merged.add(own);
        return merged;
    }

    static List<Warning> mergeWarnings(List<EnvelopeInput> inputs, PrimitiveOutcome outcome, String shortName) {
        var merged = new ArrayList<Warning>();
        for (var input : inputs) {
            input.envelope().ifPresent(envelope -> merged.addAll(envelope.warnings()));
        }
        for (var reported : outcome.warnings()) {
            merged.add(new Warning(reported.level(), shortName, reported.message()));
        }
        return merged;
    }

    private static Map<String, Object> metadata(PrimitiveOutcome outcome, String semanticType, String dataCategory) {
        var metadata = Values.copyMap(outcome.metadata());
        for (var field : TRANSPORT_FIELDS) {
            metadata.remove(field);
        }
        metadata.put(Envelope.SEMANTIC_TYPE, semanticType);
        metadata.put(Envelope.DATA_CATEGORY, dataCategory);
        return metadata;
    }

    // Passthrough primitives leave their first input in place instead of writing the output.
    private static String dataPath(BuildRequest request) {
        if (request.primitive().spec().passthrough() && !request.inputs().isEmpty()) {
            return request.inputs().get(0).path().toString();
        }
        return request.outputPath().toString();
    }
}

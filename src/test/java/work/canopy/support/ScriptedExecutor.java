package work.canopy.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import work.canopy.error.ErrorKind;
import work.canopy.primitive.PrimitiveExecutor;
import work.canopy.primitive.PrimitiveInvocation;
import work.canopy.primitive.PrimitiveOutcome;
import work.canopy.primitive.ReportedWarning;

/**
 * Deterministic in-memory primitive double. By default every primitive writes a small output file (unless it is a
 * passthrough) and reports success with a CRS; behaviour can be overridden per primitive short name.
 */
public final class ScriptedExecutor implements PrimitiveExecutor {
    private final Map<String, Function<PrimitiveInvocation, PrimitiveOutcome>> scripts = new ConcurrentHashMap<>();
    private final List<PrimitiveInvocation> invocations = new CopyOnWriteArrayList<>();

    @Override
    public PrimitiveOutcome execute(PrimitiveInvocation invocation) {
        invocations.add(invocation);
        var script = scripts.get(invocation.primitive().shortName());
        return script != null ? script.apply(invocation) : succeed(invocation, List.of());
    }

    public ScriptedExecutor on(String shortName, Function<PrimitiveInvocation, PrimitiveOutcome> script) {
        scripts.put(shortName, script);
        return this;
    }

    /**
     * The primitive writes a partial output file, then exits non-zero.
     */
    public ScriptedExecutor failing(String shortName, String error, String message) {
        return on(shortName, invocation -> {
            writeOutput(invocation, "partial");
            return PrimitiveOutcome.failure(ErrorKind.PRIMITIVE_FAILED, error, message, List.of());
        });
    }

    public ScriptedExecutor warning(String shortName, String level, String message) {
        return on(shortName, invocation -> succeed(invocation, List.of(new ReportedWarning(level, message))));
    }

    public List<PrimitiveInvocation> invocations() {
        return List.copyOf(invocations);
    }

    public List<String> invokedPrimitives() {
        var names = new ArrayList<String>();
        invocations.forEach(invocation -> names.add(invocation.primitive().shortName()));
        return names;
    }

    public static PrimitiveOutcome succeed(PrimitiveInvocation invocation, List<ReportedWarning> warnings) {
        if (!invocation.primitive().spec().passthrough()) {
            writeOutput(invocation, "{\"type\":\"FeatureCollection\",\"features\":[]}");
        }
        var response = new LinkedHashMap<String, Object>();
        response.put("status", "ok");
        response.put("crs", "EPSG:3857");
        response.put("feature_count", 0);
        var rendered = new ArrayList<Object>();
        for (var warning : warnings) {
            rendered.add(Map.of("level", warning.level(), "message", warning.message()));
        }
        response.put("warnings", rendered);
        return PrimitiveOutcome.success(response);
    }

    private static void writeOutput(PrimitiveInvocation invocation, String content) {
        try {
            Files.createDirectories(invocation.outputPath().getParent());
            Files.writeString(invocation.outputPath(), content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}

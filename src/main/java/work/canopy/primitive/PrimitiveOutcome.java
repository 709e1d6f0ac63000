package work.canopy.primitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.canopy.error.ErrorKind;
import work.canopy.envelope.Warning;
import work.canopy.shared.Values;

/**
 * Result of one primitive invocation.
 *
 * @param metadata the primitive's full JSON response on success (transport fields included)
 */
public record PrimitiveOutcome(
    boolean success,
    Map<String, Object> metadata,
    List<ReportedWarning> warnings,
    Optional<ErrorKind> errorKind,
    Optional<String> error,
    Optional<String> message
) {
    public PrimitiveOutcome {
        metadata = Values.freezeMap(metadata);
        warnings = List.copyOf(warnings);
    }

    public static PrimitiveOutcome success(Map<String, Object> response) {
        return new PrimitiveOutcome(true, response, warningsFrom(response), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static PrimitiveOutcome failure(ErrorKind kind, String error, String message, List<ReportedWarning> warnings) {
        return new PrimitiveOutcome(false, Map.of(), warnings, Optional.of(kind), Optional.ofNullable(error), Optional.ofNullable(message));
    }

    public static List<ReportedWarning> warningsFrom(Map<String, Object> response) {
        var warnings = new ArrayList<ReportedWarning>();
        for (var raw : Values.asList(response.get("warnings"))) {
            if (raw instanceof Map<?, ?>) {
                var item = Values.asMap(raw);
                warnings.add(new ReportedWarning(
                    Values.asString(item.get("level"), Warning.WARNING),
                    Values.asString(item.get("message"), "")
                ));
            } else if (raw != null) {
                warnings.add(new ReportedWarning(Warning.WARNING, String.valueOf(raw)));
            }
        }
        return warnings;
    }
}

package work.canopy.reference;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import work.canopy.error.ErrorKind;
import work.canopy.error.ReferenceException;
import work.canopy.shared.EditDistance;

/**
 * Turns raw values into {@link Reference}s. References must be the whole value; a string that starts like a
 * reference but does not match one of the four forms is rejected, as is any string embedding {@code $<letter>}.
 */
public final class ReferenceParser {
    private static final String NAME = "([a-zA-Z_][a-zA-Z0-9_]*)";
    private static final Pattern MANIFEST = Pattern.compile("\\$manifest\\." + NAME);
    private static final Pattern CHOICES = Pattern.compile("\\$choices\\." + NAME);
    private static final Pattern PARAMETERS = Pattern.compile("\\$parameters\\." + NAME);
    private static final Pattern STEPS = Pattern.compile("\\$steps\\." + NAME + "\\." + NAME);
    private static final Pattern LOOKS_LIKE_REFERENCE = Pattern.compile("^\\$[a-zA-Z]");
    private static final Pattern EMBEDDED = Pattern.compile("\\$[a-zA-Z]");
    private static final List<String> KINDS = List.of("manifest", "choices", "parameters", "steps");

    private ReferenceParser() {}

    public static Reference parse(Object value) {
        return parse(value, null);
    }

    /**
     * @param context where the value appears (e.g. {@code step 'clip' params.distance}), used in diagnostics
     */
    public static Reference parse(Object value, String context) {
        if (!(value instanceof String raw)) {
            return new Reference.Literal(value);
        }
        if (LOOKS_LIKE_REFERENCE.matcher(raw).find()) {
            var matched = match(raw);
            if (matched.isPresent()) {
                return matched.get();
            }
            throw malformed(raw, context);
        }
        if (raw.length() > 1 && EMBEDDED.matcher(raw.substring(1)).find()) {
            throw new ReferenceException(
                ErrorKind.EMBEDDED_REFERENCE,
                "Embedded reference detected in '" + raw + "'" + in(context)
                    + ". References must be the entire value, not embedded in strings.",
                raw,
                context
            );
        }
        return new Reference.Literal(raw);
    }

    /**
     * Lenient lookup used for dependency extraction; malformed values are left for validation to report.
     */
    public static Optional<Reference.StepRef> stepReference(Object value) {
        if (!(value instanceof String raw)) {
            return Optional.empty();
        }
        var matcher = STEPS.matcher(raw);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Reference.StepRef(matcher.group(1), matcher.group(2)));
    }

    private static Optional<Reference> match(String raw) {
        var matcher = STEPS.matcher(raw);
        if (matcher.matches()) {
            return Optional.of(new Reference.StepRef(matcher.group(1), matcher.group(2)));
        }
        matcher = MANIFEST.matcher(raw);
        if (matcher.matches()) {
            return Optional.of(new Reference.ManifestRef(matcher.group(1)));
        }
        matcher = CHOICES.matcher(raw);
        if (matcher.matches()) {
            return Optional.of(new Reference.ChoiceRef(matcher.group(1)));
        }
        matcher = PARAMETERS.matcher(raw);
        if (matcher.matches()) {
            return Optional.of(new Reference.ParameterRef(matcher.group(1)));
        }
        return Optional.empty();
    }

    private static ReferenceException malformed(String raw, String context) {
        var prefixes = new ArrayList<String>();
        var hints = new ArrayList<String>();
        int dot = raw.indexOf('.');
        var head = dot < 0 ? raw.substring(1) : raw.substring(1, dot);

        if (raw.startsWith("$params.") || "params".equals(head)) {
            prefixes.add(Reference.PARAMETERS);
            hints.add("Did you mean '$parameters.'? ($params is not valid)");
        } else if (raw.startsWith("$step.") || "step".equals(head)) {
            prefixes.add(Reference.STEPS);
            hints.add("Did you mean '$steps.' (plural)?");
        } else if (KINDS.contains(head) && dot < 0) {
            prefixes.add("$" + head + ".");
            hints.add("Did you mean '$" + head + "...'? (missing dot)");
        } else if (KINDS.contains(head)) {
            prefixes.add("$" + head + ".");
            hints.add(shapeHint(head));
        } else {
            for (var kind : KINDS) {
                if (raw.startsWith("$" + kind)) {
                    prefixes.add("$" + kind + ".");
                    hints.add("Did you mean '$" + kind + "...'? (missing dot)");
                    break;
                }
            }
            if (prefixes.isEmpty()) {
                for (var kind : EditDistance.closeMatches(head, KINDS)) {
                    prefixes.add("$" + kind + ".");
                    hints.add("Did you mean '$" + kind + ".'?");
                }
            }
        }

        var hintText = hints.isEmpty() ? "" : " " + String.join(" ", hints);
        return new ReferenceException(
            ErrorKind.MALFORMED_REFERENCE,
            "Invalid reference '" + raw + "'" + in(context) + ". Starts with '$' but doesn't match valid patterns." + hintText
                + " Valid formats: $manifest.{name}, $choices.{name}, $parameters.{name}, $steps.{step_id}.{output}",
            raw,
            context,
            prefixes
        );
    }

    private static String shapeHint(String kind) {
        return switch (kind) {
            case "manifest" -> "$manifest references should be $manifest.{dataset_name} (one level deep).";
            case "steps" -> "$steps references need exactly a step id and an output: $steps.{step_id}.{output}.";
            default -> "$" + kind + " references should be $" + kind + ".{name} (one level deep, letters, digits and underscores).";
        };
    }

    private static String in(String context) {
        return context == null || context.isBlank() ? "" : " in " + context;
    }
}

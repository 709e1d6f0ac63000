package work.canopy.shared;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

public final class EditDistance {
    public static final int SUGGESTION_DISTANCE = 2;

    private EditDistance() {}

    public static int levenshtein(String left, String right) {
        if (left.length() < right.length()) {
            return levenshtein(right, left);
        }
        if (right.isEmpty()) {
            return left.length();
        }
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 0; i < left.length(); i++) {
            current[0] = i + 1;
            for (int j = 0; j < right.length(); j++) {
                int insertion = previous[j + 1] + 1;
                int deletion = current[j] + 1;
                int substitution = previous[j] + (left.charAt(i) == right.charAt(j) ? 0 : 1);
                current[j + 1] = Math.min(Math.min(insertion, deletion), substitution);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    /**
     * Candidates within {@link #SUGGESTION_DISTANCE} edits of {@code name}, in candidate order.
     */
    public static List<String> closeMatches(String name, Collection<String> candidates) {
        return closeMatches(name, candidates, false);
    }

    public static List<String> closeMatches(String name, Collection<String> candidates, boolean ignoreCase) {
        var matches = new ArrayList<String>();
        if (name == null) {
            return matches;
        }
        String probe = ignoreCase ? name.toLowerCase(Locale.ROOT) : name;
        for (String candidate : candidates) {
            String other = ignoreCase ? candidate.toLowerCase(Locale.ROOT) : candidate;
            if (levenshtein(probe, other) <= SUGGESTION_DISTANCE) {
                matches.add(candidate);
            }
        }
        return matches;
    }
}

package work.canopy.envelope;

import java.util.Objects;
import java.util.Optional;

/**
 * Hash of one input file. {@code value} and {@code algorithm} are absent when hashing was skipped, in which case
 * {@code reason} says why.
 */
public record HashInfo(Optional<String> value, HashMethod method, Optional<String> algorithm, Optional<String> reason) {
    public HashInfo {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(reason, "reason");
    }

    public static HashInfo computed(String value, HashMethod method, String algorithm) {
        return new HashInfo(Optional.of(value), method, Optional.of(algorithm), Optional.empty());
    }

    public static HashInfo skipped(String reason) {
        return new HashInfo(Optional.empty(), HashMethod.SKIPPED, Optional.empty(), Optional.of(reason));
    }
}

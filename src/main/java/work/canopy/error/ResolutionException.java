package work.canopy.error;

import java.util.List;

public final class ResolutionException extends CanopyException {
    public ResolutionException(ErrorKind kind, String message, String offendingValue) {
        super(kind, message, offendingValue, null, null, null);
    }

    public ResolutionException(ErrorKind kind, String message, String offendingValue, List<String> suggestions) {
        super(kind, message, offendingValue, null, suggestions, null);
    }

    public ResolutionException(ErrorKind kind, String message, String offendingValue, Throwable cause) {
        super(kind, message, offendingValue, null, null, cause);
    }
}

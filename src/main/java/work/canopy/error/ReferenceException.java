package work.canopy.error;

import java.util.List;

public final class ReferenceException extends CanopyException {
    public ReferenceException(ErrorKind kind, String message, String offendingValue, String context) {
        super(kind, message, offendingValue, context, null, null);
    }

    public ReferenceException(ErrorKind kind, String message, String offendingValue, String context, List<String> suggestions) {
        super(kind, message, offendingValue, context, suggestions, null);
    }
}

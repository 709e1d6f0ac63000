package work.canopy.error;

public final class DocumentParseException extends CanopyException {
    public DocumentParseException(ErrorKind kind, String message, String context) {
        super(kind, message, null, context, null, null);
    }

    public DocumentParseException(String message, String context, Throwable cause) {
        super(ErrorKind.MALFORMED_DOCUMENT, message, null, context, null, cause);
    }
}

package work.canopy.error;

public final class PrimitiveExecutionException extends CanopyException {
    public PrimitiveExecutionException(ErrorKind kind, String message, String primitive) {
        super(kind, message, primitive, null, null, null);
    }

    public PrimitiveExecutionException(ErrorKind kind, String message, String primitive, Throwable cause) {
        super(kind, message, primitive, null, null, cause);
    }
}

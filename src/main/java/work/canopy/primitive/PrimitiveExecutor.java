package work.canopy.primitive;

/**
 * Port through which the engine runs an opaque primitive. Implementations return an outcome for anything the
 * primitive itself reports (including failures) and throw
 * {@link work.canopy.error.PrimitiveExecutionException} only when the primitive could not be run at all.
 */
@FunctionalInterface
public interface PrimitiveExecutor {
    PrimitiveOutcome execute(PrimitiveInvocation invocation);
}

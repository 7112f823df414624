package sift.core.exception;

/**
 * Thrown when a switch over an enum meets a constant it has no branch for.
 */
public final class UnreachableException extends RuntimeException {

    public UnreachableException(Enum<?> unhandledConstant) {
        super("Unhandled " + unhandledConstant.getDeclaringClass().getSimpleName() + ": " + unhandledConstant);
    }
}

package sift.core.exception;

/**
 * Thrown when a fully qualified test name cannot be resolved to a loadable class or one of its members.
 */
public final class UnresolvableNameException extends SelectionException {

    public UnresolvableNameException(String message) {
        super(message);
    }

    public UnresolvableNameException(String message, Throwable cause) {
        super(message, cause);
    }
}

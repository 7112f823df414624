package sift.core.exception;

/**
 * Thrown when a configuration value is well-formed but not one of its legal values.
 */
public final class ValidationException extends SelectionException {

    public ValidationException(String message) {
        super(message);
    }
}

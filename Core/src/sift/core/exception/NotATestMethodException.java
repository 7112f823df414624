package sift.core.exception;

/**
 * Thrown when a fully qualified test name resolves to something other than a method that can be run as a test.
 */
public final class NotATestMethodException extends SelectionException {

    public NotATestMethodException(String message) {
        super(message);
    }
}

package sift.core.exception;

/**
 * Thrown when an eligible test class fails while being constructed.
 */
public final class CaseInstantiationException extends SelectionException {

    public CaseInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }
}

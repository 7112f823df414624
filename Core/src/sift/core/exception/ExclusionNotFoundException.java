package sift.core.exception;

/**
 * Thrown when an exclusion names a class or method that the matching inclusion never selected.
 */
public final class ExclusionNotFoundException extends SelectionException {

    public ExclusionNotFoundException(String message) {
        super(message);
    }
}

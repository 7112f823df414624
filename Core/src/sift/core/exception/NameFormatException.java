package sift.core.exception;

/**
 * Thrown when a dotted name does not have the number of segments its context requires.
 */
public final class NameFormatException extends SelectionException {

    public NameFormatException(String message) {
        super(message);
    }
}

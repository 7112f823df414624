package sift.core.exception;

/**
 * Thrown when parsing a configuration and finding that it is not structured as expected.
 */
public final class ParseException extends SelectionException {

    public ParseException(String message) {
        super(message);
    }
}

package sift.core.exception;

/**
 * The base of every error raised while turning a test-selection configuration into loaded test cases.
 */
public class SelectionException extends Exception {

    public SelectionException(String message) {
        super(message);
    }

    public SelectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

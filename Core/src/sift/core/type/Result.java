package sift.core.type;

import sift.core.exception.SelectionException;

/**
 * The outcome of an operation that reports its failure as a message rather than by throwing.
 *
 * A successful result holds data, an error result holds a message describing what went wrong.
 */
public final class Result<D> {
    private final boolean success;
    private final D data;
    private final String error;

    private Result(boolean success, D data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <D> Result<D> successful(D data) {
        return new Result<>(true, data, null);
    }

    public static <D> Result<D> error(String error) {
        if (error == null) {
            throw new NullPointerException("error must be non-null.");
        }
        return new Result<>(false, null, error);
    }

    /**
     * Returns an error result describing the given failure as {@code ExceptionName: message}.
     *
     * @param failure The failure.
     * @return the error result.
     */
    public static <D> Result<D> failedWith(SelectionException failure) {
        return error(failure.getClass().getSimpleName() + ": " + failure.getMessage());
    }

    public boolean isSuccess() {
        return this.success;
    }

    public D getData() {
        return this.data;
    }

    public String getError() {
        return this.error;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + (this.success ? "data: " + this.data : "error: " + this.error) + " }";
    }
}

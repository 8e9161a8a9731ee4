package io.github.yok.cleansync.exception;

/**
 * Raised when a normalization step fails on malformed data, or when the row count invariant
 * is violated.
 *
 * @author Yasuharu.Okawauchi
 */
public class TransformException extends SyncException {

    private static final long serialVersionUID = 1L;

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}

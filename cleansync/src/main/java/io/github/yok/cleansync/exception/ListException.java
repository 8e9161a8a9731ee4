package io.github.yok.cleansync.exception;

/**
 * Raised when the root or destination container cannot be enumerated, or the existing audit
 * log cannot be read. Fatal.
 *
 * @author Yasuharu.Okawauchi
 */
public class ListException extends SyncException {

    private static final long serialVersionUID = 1L;

    public ListException(String message) {
        super(message);
    }

    public ListException(String message, Throwable cause) {
        super(message, cause);
    }
}

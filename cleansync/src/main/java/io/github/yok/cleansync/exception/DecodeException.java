package io.github.yok.cleansync.exception;

/**
 * Raised when none of the candidate text encodings parses a payload as CSV.
 *
 * <p>
 * The failure of each attempted encoding is attached as a suppressed exception.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DecodeException extends SyncException {

    private static final long serialVersionUID = 1L;

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

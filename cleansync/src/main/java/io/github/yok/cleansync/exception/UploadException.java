package io.github.yok.cleansync.exception;

/**
 * Raised when a cleaned payload cannot be persisted to the destination container.
 *
 * @author Yasuharu.Okawauchi
 */
public class UploadException extends SyncException {

    private static final long serialVersionUID = 1L;

    public UploadException(String message) {
        super(message);
    }

    public UploadException(String message, Throwable cause) {
        super(message, cause);
    }
}

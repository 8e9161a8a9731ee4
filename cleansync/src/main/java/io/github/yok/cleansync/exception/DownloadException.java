package io.github.yok.cleansync.exception;

/**
 * Raised when the content of a source item cannot be fetched.
 *
 * @author Yasuharu.Okawauchi
 */
public class DownloadException extends SyncException {

    private static final long serialVersionUID = 1L;

    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.github.yok.cleansync.exception;

/**
 * Raised when credentials for the remote file store cannot be established. Fatal.
 *
 * @author Yasuharu.Okawauchi
 */
public class AuthException extends SyncException {

    private static final long serialVersionUID = 1L;

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}

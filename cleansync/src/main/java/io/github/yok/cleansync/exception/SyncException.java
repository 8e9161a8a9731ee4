package io.github.yok.cleansync.exception;

/**
 * Base class of every failure raised while synchronizing CSV files.
 *
 * <p>
 * Subclasses are split into two groups:
 * </p>
 * <ul>
 * <li><strong>setup failures</strong> ({@link AuthException}, {@link ListException}) abort the
 * whole run before any file is touched.</li>
 * <li><strong>per-file failures</strong> ({@link DownloadException}, {@link DecodeException},
 * {@link TransformException}, {@link UploadException}) are caught at the file boundary and written
 * to the audit log as {@code fail} rows.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class SyncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}

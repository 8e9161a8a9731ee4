package io.github.yok.cleansync.config;

/**
 * Enumeration of the supported remote file store back ends.
 *
 * @author Yasuharu.Okawauchi
 */
public enum StoreType {

    // Directory tree on a locally mounted file system.
    LOCAL,

    // Google Drive, accessed through the Drive v3 REST API.
    DRIVE
}

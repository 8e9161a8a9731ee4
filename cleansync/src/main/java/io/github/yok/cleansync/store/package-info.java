/**
 * Remote file store abstraction and its back ends.
 *
 * <p>
 * {@link io.github.yok.cleansync.store.RemoteFileStore} is the only way the sync core reads or
 * writes remote content. {@link io.github.yok.cleansync.store.RemoteFileStoreFactory} selects a
 * local directory tree or Google Drive from configuration.
 * </p>
 */
package io.github.yok.cleansync.store;

package io.github.yok.cleansync.store;

import io.github.yok.cleansync.exception.AuthException;
import io.github.yok.cleansync.exception.DownloadException;
import io.github.yok.cleansync.exception.ListException;
import io.github.yok.cleansync.exception.UploadException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Hierarchical file store holding the raw CSV files, the cleaned outputs and the audit log.
 *
 * <p>
 * Items live in containers (folders) identified by opaque ids. Every call is synchronous and
 * blocking. Implementations raise {@link AuthException} when the store rejects the credentials.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface RemoteFileStore {

    /**
     * Lists the direct children of a container.
     *
     * @param containerId parent container
     * @param query filter on title/type
     * @return matching children, in store order
     * @throws ListException if the container cannot be enumerated
     */
    List<RemoteItem> listChildren(String containerId, ItemQuery query);

    /**
     * Finds an item by exact title within a container. When several items share the title, the
     * first one listed wins.
     *
     * @param containerId parent container
     * @param title exact title
     * @return the item, or empty
     * @throws ListException if the container cannot be enumerated
     */
    default Optional<RemoteItem> findByName(String containerId, String title) {
        return listChildren(containerId, ItemQuery.named(title)).stream().findFirst();
    }

    /**
     * Returns the id of the sub-container {@code name}, creating it when missing.
     *
     * @param containerId parent container
     * @param name sub-container name
     * @return sub-container id
     * @throws ListException if the sub-container cannot be looked up or created
     */
    String ensureSubfolder(String containerId, String name);

    /**
     * Downloads the content of an item into a local file.
     *
     * @param item item to fetch
     * @param target local file (created or overwritten)
     * @throws DownloadException if the content cannot be fetched
     */
    void download(RemoteItem item, Path target);

    /**
     * Creates a new item, or overwrites the content of an existing one in place.
     *
     * @param containerId parent container
     * @param source local content
     * @param title title of the item
     * @param existingId id of the item to overwrite, or {@code null} to create
     * @return id of the written item ({@code existingId} when overwriting)
     * @throws UploadException if the content cannot be persisted
     */
    String createOrOverwrite(String containerId, Path source, String title, String existingId);
}

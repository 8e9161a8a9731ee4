package io.github.yok.cleansync.core;

import io.github.yok.cleansync.exception.SyncException;
import io.github.yok.cleansync.exception.UploadException;
import io.github.yok.cleansync.store.RemoteFileStore;
import io.github.yok.cleansync.store.RemoteItem;
import java.nio.file.Path;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Writes a local file to a container under a fixed name, overwriting the item of that name when it
 * already exists.
 *
 * <p>
 * Overwriting keeps the item id, so repeated runs against the same destination name always report
 * the same id.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class UpsertWriter {

    private final RemoteFileStore store;

    // Appended to the base name of a source, e.g. "_cleaned.csv"
    private final String cleanedSuffix;

    /**
     * Creates or overwrites {@code name} in {@code containerId}.
     *
     * @param containerId destination container
     * @param localPayload local file holding the content
     * @param name item name
     * @return id of the destination item
     * @throws UploadException if the lookup or the write fails
     */
    public String upsert(String containerId, Path localPayload, String name) {
        Optional<RemoteItem> existing;
        try {
            existing = store.findByName(containerId, name);
        } catch (SyncException e) {
            throw new UploadException("Cannot look up " + name + ": " + e.getMessage(), e);
        }
        String existingId = existing.map(RemoteItem::getId).orElse(null);
        String id = store.createOrOverwrite(containerId, localPayload, name, existingId);
        log.debug("{} {} ({})", existingId != null ? "Overwrote" : "Created", name, id);
        return id;
    }

    /**
     * Derives the destination name of a source: the title without its extension, followed by the
     * cleaned suffix ({@code report.csv → report_cleaned.csv}).
     *
     * @param sourceTitle title of the source item
     * @return destination name
     */
    public String cleanedNameFor(String sourceTitle) {
        return FilenameUtils.removeExtension(sourceTitle) + cleanedSuffix;
    }
}

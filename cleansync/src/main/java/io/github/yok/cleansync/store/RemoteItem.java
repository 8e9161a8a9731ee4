package io.github.yok.cleansync.store;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Item (file or folder) held by a {@link RemoteFileStore}.
 *
 * <p>
 * {@code modifiedTime} is kept as the raw RFC 3339 string reported by the store; it may be
 * {@code null} or unparsable and is interpreted by the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public class RemoteItem {

    /**
     * MIME type that marks an item as a folder.
     */
    public static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";

    private final String id;

    private final String title;

    private final String modifiedTime;

    private final String mimeType;

    /**
     * @return whether this item is a folder (container)
     */
    public boolean isFolder() {
        return FOLDER_MIME_TYPE.equals(mimeType);
    }
}

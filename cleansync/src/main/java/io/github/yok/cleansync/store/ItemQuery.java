package io.github.yok.cleansync.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Filter applied by {@link RemoteFileStore#listChildren}.
 *
 * <p>
 * Every criterion left {@code null} (or {@code false}) matches all items.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ItemQuery {

    private static final ItemQuery ALL = new ItemQuery(null, null, false);

    // Exact title to match
    private final String title;

    // Exact MIME type to match
    private final String mimeType;

    // Whether folders are left out
    private final boolean excludeFolders;

    /**
     * @return query matching every child
     */
    public static ItemQuery all() {
        return ALL;
    }

    /**
     * @param title exact title
     * @return query matching items with the given title
     */
    public static ItemQuery named(String title) {
        return new ItemQuery(title, null, false);
    }

    /**
     * @param name exact folder name
     * @return query matching folders with the given name
     */
    public static ItemQuery folderNamed(String name) {
        return new ItemQuery(name, RemoteItem.FOLDER_MIME_TYPE, false);
    }

    /**
     * @return query matching every child that is not a folder
     */
    public static ItemQuery filesOnly() {
        return new ItemQuery(null, null, true);
    }

    /**
     * Evaluates this query in memory, for back ends that cannot filter server side.
     *
     * @param item candidate
     * @return whether the item satisfies every criterion
     */
    public boolean matches(RemoteItem item) {
        if (title != null && !title.equals(item.getTitle())) {
            return false;
        }
        if (mimeType != null && !mimeType.equals(item.getMimeType())) {
            return false;
        }
        return !(excludeFolders && item.isFolder());
    }
}

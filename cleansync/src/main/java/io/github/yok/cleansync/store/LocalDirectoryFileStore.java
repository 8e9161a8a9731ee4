package io.github.yok.cleansync.store;

import com.google.common.base.Preconditions;
import io.github.yok.cleansync.exception.DownloadException;
import io.github.yok.cleansync.exception.ListException;
import io.github.yok.cleansync.exception.UploadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * {@link RemoteFileStore} backed by a directory tree, for folders synchronized to a local or
 * network-mounted file system.
 *
 * <p>
 * Containers are directories. Ids are paths relative to the base directory using {@code /} as the
 * separator; the empty id and {@code "."} denote the base directory itself. Ids that resolve
 * outside the base directory are rejected. The modification time is the file's last-modified
 * time.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LocalDirectoryFileStore implements RemoteFileStore {

    private final Path baseDir;

    /**
     * Creates a store rooted at {@code baseDir}.
     *
     * @param baseDir base directory
     * @throws NullPointerException if {@code baseDir} is {@code null}
     */
    public LocalDirectoryFileStore(Path baseDir) {
        Preconditions.checkNotNull(baseDir, "baseDir must not be null");
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    @Override
    public List<RemoteItem> listChildren(String containerId, ItemQuery query) {
        List<RemoteItem> items = new ArrayList<>();
        try {
            Path dir = resolve(containerId);
            if (!Files.isDirectory(dir)) {
                throw new ListException("Container not found: " + containerId);
            }
            List<Path> children;
            try (Stream<Path> stream = Files.list(dir)) {
                children = stream.sorted(Comparator.comparing(Path::getFileName))
                        .collect(Collectors.toList());
            }
            for (Path child : children) {
                RemoteItem item = toItem(child);
                if (query.matches(item)) {
                    items.add(item);
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new ListException("Cannot list container " + containerId, e);
        }
        log.debug("Listed {} item(s) in '{}' ({})", items.size(), containerId, query);
        return items;
    }

    @Override
    public String ensureSubfolder(String containerId, String name) {
        try {
            Path parent = resolve(containerId);
            if (!Files.isDirectory(parent)) {
                throw new ListException("Container not found: " + containerId);
            }
            Path dir = resolveChild(parent, name);
            if (!Files.isDirectory(dir)) {
                Files.createDirectory(dir);
                log.info("Created folder {}", idOf(dir));
            }
            return idOf(dir);
        } catch (IOException | IllegalArgumentException e) {
            throw new ListException("Cannot create folder " + name + " in " + containerId, e);
        }
    }

    @Override
    public void download(RemoteItem item, Path target) {
        try {
            Files.copy(resolve(item.getId()), target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | IllegalArgumentException e) {
            throw new DownloadException("Cannot download " + item.getTitle(), e);
        }
    }

    @Override
    public String createOrOverwrite(String containerId, Path source, String title,
            String existingId) {
        try {
            Path target = existingId != null ? resolve(existingId)
                    : resolveChild(resolve(containerId), title);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return idOf(target);
        } catch (IOException | IllegalArgumentException e) {
            throw new UploadException("Cannot write " + title + " to " + containerId, e);
        }
    }

    private RemoteItem toItem(Path path) throws IOException {
        String title = path.getFileName().toString();
        String mimeType;
        if (Files.isDirectory(path)) {
            mimeType = RemoteItem.FOLDER_MIME_TYPE;
        } else if ("csv".equalsIgnoreCase(FilenameUtils.getExtension(title))) {
            mimeType = "text/csv";
        } else {
            mimeType = "application/octet-stream";
        }
        String modified = Files.getLastModifiedTime(path).toInstant().toString();
        return new RemoteItem(idOf(path), title, modified, mimeType);
    }

    /**
     * Resolves an id against the base directory.
     *
     * @param id base-relative id
     * @return absolute path
     * @throws IllegalArgumentException if the id escapes the base directory
     */
    Path resolve(String id) {
        String relative = Objects.toString(id, "");
        return checkInsideBase(baseDir.resolve(relative).normalize(), id);
    }

    private Path resolveChild(Path parent, String name) {
        return checkInsideBase(parent.resolve(name).normalize(), name);
    }

    private Path checkInsideBase(Path path, String name) {
        if (!path.startsWith(baseDir)) {
            throw new IllegalArgumentException("Id outside of base directory: " + name);
        }
        return path;
    }

    private String idOf(Path path) {
        return FilenameUtils.separatorsToUnix(baseDir.relativize(path).toString());
    }
}

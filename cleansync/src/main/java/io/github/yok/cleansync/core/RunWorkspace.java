package io.github.yok.cleansync.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Temporary directory holding the local artifacts of one run: downloaded sources, cleaned outputs
 * and the working copy of the audit log.
 *
 * <p>
 * Use with try-with-resources; the directory and everything below it is removed on close.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class RunWorkspace implements AutoCloseable {

    @Getter
    private final Path dir;

    private final Path sourceDir;

    private final Path cleanedDir;

    private RunWorkspace(Path dir) throws IOException {
        this.dir = dir;
        this.sourceDir = Files.createDirectory(dir.resolve("source"));
        this.cleanedDir = Files.createDirectory(dir.resolve("cleaned"));
    }

    /**
     * Creates a fresh workspace below {@code parent}.
     *
     * @param parent parent directory, created when missing
     * @return the workspace
     * @throws UncheckedIOException if the directory cannot be created
     */
    public static RunWorkspace create(Path parent) {
        try {
            Files.createDirectories(parent);
            Path dir = Files.createTempDirectory(parent, "cleansync-");
            log.debug("Created run workspace {}", dir);
            return new RunWorkspace(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create run workspace under " + parent, e);
        }
    }

    /**
     * @param title source title
     * @return local path for the downloaded source
     */
    public Path sourceFile(String title) {
        return sourceDir.resolve(safeName(title));
    }

    /**
     * @param name destination name
     * @return local path for the cleaned output
     */
    public Path cleanedFile(String name) {
        return cleanedDir.resolve(safeName(name));
    }

    @Override
    public void close() {
        try {
            FileUtils.deleteDirectory(dir.toFile());
            log.debug("Removed run workspace {}", dir);
        } catch (IOException e) {
            log.warn("Could not remove run workspace {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Replaces characters that are not allowed in local file names.
     *
     * @param name remote title
     * @return file name usable on any platform
     */
    static String safeName(String name) {
        String cleaned = name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_");
        return cleaned.isEmpty() || ".".equals(cleaned) || "..".equals(cleaned) ? "_" + cleaned
                : cleaned;
    }
}

package io.github.yok.cleansync.core;

import io.github.yok.cleansync.exception.DownloadException;
import io.github.yok.cleansync.exception.ListException;
import io.github.yok.cleansync.exception.UploadException;
import io.github.yok.cleansync.store.RemoteFileStore;
import io.github.yok.cleansync.store.RemoteItem;
import io.github.yok.cleansync.util.CsvUtils;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Append-only ledger of processing attempts, kept as one CSV item per destination container.
 *
 * <p>
 * <strong>Lifecycle:</strong>
 * </p>
 * <ol>
 * <li>{@link #load} pulls the existing item into the run workspace, or initializes a header-only
 * working copy when there is none.</li>
 * <li>{@link #append} adds entries in memory only.</li>
 * <li>{@link #flush} writes every entry (previous and new) and overwrites the remote item.</li>
 * </ol>
 *
 * <p>
 * This is a read-modify-write on remote state without locking: at most one run may use a given
 * destination container at a time.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AuditLog {

    private final RemoteFileStore store;

    private final String containerId;

    private final String logName;

    // Working copy inside the run workspace
    private final Path localFile;

    private final List<AuditLogEntry> entries;

    // Number of entries read from the persisted log
    private final int loadedCount;

    // Id of the persisted log item, null until it exists
    private String itemId;

    private AuditLog(RemoteFileStore store, String containerId, String logName, Path localFile,
            List<AuditLogEntry> entries, String itemId) {
        this.store = store;
        this.containerId = containerId;
        this.logName = logName;
        this.localFile = localFile;
        this.entries = new ArrayList<>(entries);
        this.loadedCount = entries.size();
        this.itemId = itemId;
    }

    /**
     * Loads the log of a destination container. A missing log item yields an empty log.
     *
     * @param store remote store
     * @param containerId destination container
     * @param logName name of the log item
     * @param workDir run workspace directory receiving the working copy
     * @return loaded log
     * @throws ListException if an existing log item cannot be fetched or read
     */
    public static AuditLog load(RemoteFileStore store, String containerId, String logName,
            Path workDir) {
        Path localFile = workDir.resolve(logName);
        Optional<RemoteItem> existing = store.findByName(containerId, logName);
        if (existing.isEmpty()) {
            log.info("No audit log '{}' yet; starting an empty one", logName);
            writeEntries(localFile, Collections.emptyList());
            return new AuditLog(store, containerId, logName, localFile, Collections.emptyList(),
                    null);
        }
        try {
            store.download(existing.get(), localFile);
        } catch (DownloadException e) {
            throw new ListException("Cannot fetch audit log " + logName + ": " + e.getMessage(),
                    e);
        }
        List<AuditLogEntry> entries = readEntries(localFile);
        log.info("Loaded audit log '{}' with {} entries", logName, entries.size());
        return new AuditLog(store, containerId, logName, localFile, entries,
                existing.get().getId());
    }

    /**
     * Adds an entry in memory. Nothing is persisted until {@link #flush()}.
     *
     * @param entry entry to add
     */
    public void append(AuditLogEntry entry) {
        entries.add(entry);
    }

    /**
     * @return every entry, persisted ones first, in append order
     */
    public List<AuditLogEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * @return number of entries appended since {@link #load}
     */
    public int appendedCount() {
        return entries.size() - loadedCount;
    }

    /**
     * Writes the full sequence of entries and overwrites the persisted log item.
     *
     * @return id of the log item
     * @throws UploadException if the log cannot be written or uploaded
     */
    public String flush() {
        writeEntries(localFile, entries);
        itemId = store.createOrOverwrite(containerId, localFile, logName, itemId);
        log.info("Audit log '{}' saved with {} entries ({} new)", logName, entries.size(),
                appendedCount());
        return itemId;
    }

    /**
     * Reads persisted entries positionally. The header row is skipped without being checked.
     *
     * @param file working copy
     * @return entries in file order
     */
    static List<AuditLogEntry> readEntries(Path file) {
        CSVFormat format = CSVFormat.DEFAULT.builder().setSkipHeaderRecord(false)
                .setIgnoreEmptyLines(true).get();
        List<AuditLogEntry> result = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = CSVParser.parse(reader, format)) {
            boolean header = true;
            for (CSVRecord record : parser) {
                if (header) {
                    header = false;
                    continue;
                }
                result.add(AuditLogEntry.fromCells(record.toList()));
            }
        } catch (IOException | UncheckedIOException e) {
            throw new ListException("Cannot read audit log " + file.getFileName(), e);
        }
        return result;
    }

    private static void writeEntries(Path file, List<AuditLogEntry> entries) {
        List<List<String>> rows = new ArrayList<>(entries.size());
        for (AuditLogEntry entry : entries) {
            rows.add(entry.toCells());
        }
        try {
            CsvUtils.writeCsvUtf8(file, AuditLogEntry.COLUMNS, rows);
        } catch (IOException e) {
            throw new UploadException("Cannot write audit log " + file.getFileName(), e);
        }
    }
}

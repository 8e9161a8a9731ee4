package io.github.yok.cleansync.core;

import io.github.yok.cleansync.config.PathsConfig;
import io.github.yok.cleansync.config.SyncConfig;
import io.github.yok.cleansync.exception.AuthException;
import io.github.yok.cleansync.exception.ListException;
import io.github.yok.cleansync.exception.UploadException;
import io.github.yok.cleansync.store.ItemQuery;
import io.github.yok.cleansync.store.RemoteFileStore;
import io.github.yok.cleansync.store.RemoteItem;
import io.github.yok.cleansync.transform.CsvTransformer;
import io.github.yok.cleansync.transform.TransformResult;
import io.github.yok.cleansync.util.TimestampParser;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Runs one incremental synchronization of a root container into its cleaned sub-container.
 *
 * <p>
 * <strong>Setup</strong> (any failure aborts the run):
 * </p>
 * <ol>
 * <li>Resolve (or create) the destination container {@code sync.cleaned-folder-name}.</li>
 * <li>Load the audit log of the destination container.</li>
 * <li>List the {@code .csv} files of the root container and the items of the destination
 * container.</li>
 * </ol>
 *
 * <p>
 * <strong>Per file</strong>, in listing order:
 * </p>
 * <ul>
 * <li>not modified today while "today only" is set: ignored, not logged, not counted</li>
 * <li>destination at least as fresh as the source: skipped, not logged</li>
 * <li>otherwise download, transform, upload; the attempt is logged as {@code ok} or
 * {@code fail}</li>
 * </ul>
 *
 * <p>
 * A failing file never stops the run. The audit log is flushed once, after the last file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SyncOrchestrator {

    private final RemoteFileStore store;

    // sync.* settings (folder, log and suffix names)
    private final SyncConfig syncConfig;

    // Parent of the run workspace
    private final PathsConfig pathsConfig;

    private final ChangeDetector changeDetector;

    private final CsvTransformer transformer;

    private final UpsertWriter upsertWriter;

    private final Clock clock;

    /**
     * Creates an orchestrator with the default collaborators.
     *
     * @param store remote store
     * @param syncConfig sync settings
     * @param pathsConfig workspace settings
     * @param clock clock for log timestamps and the "today" filter
     */
    public SyncOrchestrator(RemoteFileStore store, SyncConfig syncConfig, PathsConfig pathsConfig,
            Clock clock) {
        this(store, syncConfig, pathsConfig, new ChangeDetector(clock), new CsvTransformer(),
                new UpsertWriter(store, syncConfig.getCleanedSuffix()), clock);
    }

    SyncOrchestrator(RemoteFileStore store, SyncConfig syncConfig, PathsConfig pathsConfig,
            ChangeDetector changeDetector, CsvTransformer transformer, UpsertWriter upsertWriter,
            Clock clock) {
        this.store = store;
        this.syncConfig = syncConfig;
        this.pathsConfig = pathsConfig;
        this.changeDetector = changeDetector;
        this.transformer = transformer;
        this.upsertWriter = upsertWriter;
        this.clock = clock;
    }

    /**
     * Executes one run.
     *
     * @param options run parameters
     * @return counters of the run
     * @throws AuthException if the store rejects the credentials during setup
     * @throws ListException if a container or the existing log cannot be read
     * @throws UploadException if the audit log cannot be saved at the end of the run
     */
    public RunSummary run(SyncOptions options) {
        log.info("Sync started: {}", options);
        try (RunWorkspace workspace = RunWorkspace.create(pathsConfig.getWorkDir())) {
            String rootId = options.getRootFolderId();
            String cleanedId = store.ensureSubfolder(rootId, syncConfig.getCleanedFolderName());
            AuditLog auditLog =
                    AuditLog.load(store, cleanedId, syncConfig.getLogName(), workspace.getDir());

            List<RemoteItem> sources = discover(rootId);
            Map<String, RemoteItem> destinations =
                    indexByTitle(store.listChildren(cleanedId, ItemQuery.filesOnly()));
            log.info("Found {} CSV file(s) in {}", sources.size(), rootId);

            List<FileOutcome> outcomes = new ArrayList<>(sources.size());
            for (RemoteItem source : sources) {
                RemoteItem destination =
                        destinations.get(upsertWriter.cleanedNameFor(source.getTitle()));
                FileOutcome outcome = processFile(source, destination, cleanedId, options,
                        workspace);
                outcome.getEntry().ifPresent(auditLog::append);
                outcomes.add(outcome);
            }

            auditLog.flush();
            RunSummary summary = RunSummary.of(outcomes);
            log.info("Sync finished: {}", summary);
            return summary;
        }
    }

    /**
     * Lists the candidate files of the root container: non-folder items whose title ends in
     * {@code .csv} (case-insensitive).
     *
     * @param rootId root container
     * @return candidates in listing order
     */
    List<RemoteItem> discover(String rootId) {
        return store.listChildren(rootId, ItemQuery.filesOnly()).stream()
                .filter(item -> item.getTitle() != null
                        && item.getTitle().toLowerCase(Locale.ROOT).endsWith(".csv"))
                .collect(Collectors.toList());
    }

    /**
     * Moves one source file to its terminal state.
     *
     * @param source source item
     * @param destination existing cleaned item, or {@code null}
     * @param cleanedId destination container
     * @param options run parameters
     * @param workspace run workspace
     * @return outcome, with an audit entry when the file was attempted
     */
    FileOutcome processFile(RemoteItem source, RemoteItem destination, String cleanedId,
            SyncOptions options, RunWorkspace workspace) {
        String title = source.getTitle();
        if (options.isRunTodayOnly() && !changeDetector.isToday(source, options.getZone())) {
            log.debug("Ignored (not modified today): {}", title);
            return FileOutcome.dateFiltered(source);
        }
        if (changeDetector.isUpToDate(source, destination)) {
            log.info("SKIP (up to date): {}", title);
            return FileOutcome.upToDate(source);
        }

        String cleanedName = upsertWriter.cleanedNameFor(title);
        try {
            Path localSource = workspace.sourceFile(title);
            store.download(source, localSource);
            TransformResult result = transformer.transform(localSource);
            Path localCleaned = workspace.cleanedFile(cleanedName);
            transformer.write(result.getPayload(), localCleaned);
            String dstId = upsertWriter.upsert(cleanedId, localCleaned, cleanedName);
            log.info("OK: {} -> {} ({}→{})", title, cleanedName, result.getRowsIn(),
                    result.getRowsOut());
            return FileOutcome.succeeded(source, AuditLogEntry.succeeded(now(), source, dstId,
                    cleanedName, result.getRowsIn(), result.getRowsOut()));
        } catch (RuntimeException e) {
            String message = StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getName());
            log.warn("FAIL: {} | {}", title, message);
            log.debug("Failure detail for {}", title, e);
            return FileOutcome.failed(source,
                    AuditLogEntry.failed(now(), source, cleanedName, message));
        }
    }

    private Map<String, RemoteItem> indexByTitle(List<RemoteItem> items) {
        Map<String, RemoteItem> index = new LinkedHashMap<>();
        for (RemoteItem item : items) {
            index.putIfAbsent(item.getTitle(), item);
        }
        return index;
    }

    private String now() {
        return TimestampParser.formatUtcSeconds(clock.instant());
    }
}

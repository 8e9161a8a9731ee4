package io.github.yok.cleansync.core;

import io.github.yok.cleansync.store.RemoteItem;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Terminal state reached by one source file in a run, with the audit entry it produced.
 *
 * <p>
 * Only {@link State#SUCCEEDED} and {@link State#FAILED} carry an entry; filtered and up-to-date
 * files are not logged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FileOutcome {

    /**
     * Terminal states of the per-file state machine.
     */
    public enum State {
        // Rejected by the "today only" filter; not logged, not counted.
        DATE_FILTERED,
        // Destination at least as fresh as the source; not logged, counted as skipped.
        UP_TO_DATE,
        // Downloaded, transformed and uploaded.
        SUCCEEDED,
        // Some step raised; logged as fail.
        FAILED
    }

    private final RemoteItem source;

    private final State state;

    @Getter(AccessLevel.NONE)
    private final AuditLogEntry entry;

    public static FileOutcome dateFiltered(RemoteItem source) {
        return new FileOutcome(source, State.DATE_FILTERED, null);
    }

    public static FileOutcome upToDate(RemoteItem source) {
        return new FileOutcome(source, State.UP_TO_DATE, null);
    }

    public static FileOutcome succeeded(RemoteItem source, AuditLogEntry entry) {
        return new FileOutcome(source, State.SUCCEEDED, entry);
    }

    public static FileOutcome failed(RemoteItem source, AuditLogEntry entry) {
        return new FileOutcome(source, State.FAILED, entry);
    }

    /**
     * @return audit entry produced by this attempt, empty when the file was not processed
     */
    public Optional<AuditLogEntry> getEntry() {
        return Optional.ofNullable(entry);
    }
}

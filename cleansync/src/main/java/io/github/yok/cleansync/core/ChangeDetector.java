package io.github.yok.cleansync.core;

import io.github.yok.cleansync.store.RemoteItem;
import io.github.yok.cleansync.util.TimestampParser;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a source file has to be (re)processed in the current run.
 *
 * <p>
 * Timestamps that are absent or unparsable are treated as unknown. An unknown source time never
 * passes the "today only" filter, and an unknown time on either side never counts as up to date,
 * so the detector errs on the side of processing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ChangeDetector {

    private final Clock clock;

    /**
     * Creates a detector on the system clock.
     */
    public ChangeDetector() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a detector on the given clock.
     *
     * @param clock clock deciding what "today" is
     */
    public ChangeDetector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Decides whether {@code source} must be processed.
     *
     * @param source source item
     * @param destination existing cleaned item, or {@code null} when there is none
     * @param runTodayOnly whether only files modified today are eligible
     * @param zone zone in which "today" is evaluated
     * @return {@code true} if the source has to be processed
     */
    public boolean shouldProcess(RemoteItem source, RemoteItem destination, boolean runTodayOnly,
            ZoneId zone) {
        if (runTodayOnly && !isToday(source, zone)) {
            return false;
        }
        return !isUpToDate(source, destination);
    }

    /**
     * Checks whether the source was modified on the current calendar date in {@code zone}.
     *
     * @param source source item
     * @param zone zone used for both the modification time and the current date
     * @return {@code false} when the modification time is unknown
     */
    public boolean isToday(RemoteItem source, ZoneId zone) {
        Optional<Instant> modified = TimestampParser.parse(source.getModifiedTime());
        LocalDate today = LocalDate.now(clock.withZone(zone));
        boolean result = modified.map(t -> LocalDate.ofInstant(t, zone).equals(today))
                .orElse(false);
        log.debug("{} modified {} -> today({} {}) = {}", source.getTitle(),
                source.getModifiedTime(), today, zone, result);
        return result;
    }

    /**
     * Checks whether the destination is at least as fresh as the source.
     *
     * @param source source item
     * @param destination cleaned item, or {@code null}
     * @return {@code true} only when both times are known and the destination is not older
     */
    public boolean isUpToDate(RemoteItem source, RemoteItem destination) {
        if (destination == null) {
            return false;
        }
        Optional<Instant> sourceTime = TimestampParser.parse(source.getModifiedTime());
        Optional<Instant> destinationTime = TimestampParser.parse(destination.getModifiedTime());
        return sourceTime.isPresent() && destinationTime.isPresent()
                && !destinationTime.get().isBefore(sourceTime.get());
    }
}

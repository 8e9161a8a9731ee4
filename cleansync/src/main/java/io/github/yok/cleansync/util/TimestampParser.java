package io.github.yok.cleansync.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Optional;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Lenient parser for the modification timestamps reported by a remote file store.
 *
 * <p>
 * A value that cannot be parsed is reported as absent instead of raising an error. Callers treat an
 * absent timestamp as "unknown", which favors reprocessing a file over silently skipping it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class TimestampParser {

    /**
     * RFC 3339 parser accepting {@code 2026-10-19T08:15:30Z}, {@code 2026-10-19T08:15:30.123+09:00}
     * and, without an offset, {@code 2026-10-19T08:15:30} (read as UTC).
     */
    static final DateTimeFormatter FLEXIBLE_TIMESTAMP_PARSER =
            new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME).optionalStart()
                    .appendOffsetId().optionalEnd()
                    .parseDefaulting(ChronoField.OFFSET_SECONDS, 0).toFormatter();

    private static final DateTimeFormatter UTC_SECONDS_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private TimestampParser() {}

    /**
     * Parses an RFC 3339 / ISO-8601 timestamp.
     *
     * @param value raw value, may be {@code null}
     * @return parsed instant, or empty if the value is blank or unparsable
     */
    public static Optional<Instant> parse(String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(
                    OffsetDateTime.parse(value.trim(), FLEXIBLE_TIMESTAMP_PARSER).toInstant());
        } catch (DateTimeException ex) {
            log.debug("Unparsable timestamp treated as absent: '{}' ({})", value, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Resolves a time zone name, falling back to UTC for unknown names.
     *
     * @param zoneName IANA zone name such as {@code America/New_York}
     * @return resolved zone
     */
    public static ZoneId zoneOrUtc(String zoneName) {
        if (StringUtils.isBlank(zoneName)) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zoneName.trim());
        } catch (DateTimeException ex) {
            log.warn("Unknown time zone '{}', falling back to UTC: {}", zoneName, ex.getMessage());
            return ZoneOffset.UTC;
        }
    }

    /**
     * Formats an instant as an ISO-8601 UTC timestamp with second precision and an explicit
     * {@code +00:00} offset.
     *
     * @param instant instant to format
     * @return formatted timestamp
     */
    public static String formatUtcSeconds(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC).format(UTC_SECONDS_FORMATTER);
    }
}

package io.github.yok.cleansync.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.cleansync.store.RemoteItem;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * One row of the audit log: a single processing attempt of a source file.
 *
 * <p>
 * On failure {@code dstId}, {@code rowsIn} and {@code rowsOut} are {@code null} and written as
 * empty cells; {@code dstTitle} still names the intended destination.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public class AuditLogEntry {

    /**
     * Column order of the persisted log.
     */
    public static final List<String> COLUMNS = ImmutableList.of("timestamp", "src_id",
            "src_title", "src_modified", "dst_id", "dst_title", "rows_in", "rows_out", "status",
            "message");

    private final String timestamp;
    private final String srcId;
    private final String srcTitle;
    private final String srcModified;
    private final String dstId;
    private final String dstTitle;
    private final Integer rowsIn;
    private final Integer rowsOut;
    private final AuditStatus status;
    private final String message;

    /**
     * Builds the entry of a successful attempt.
     *
     * @param timestamp attempt time (UTC, ISO-8601)
     * @param source processed source
     * @param dstId id of the written destination
     * @param dstTitle name of the written destination
     * @param rowsIn rows read
     * @param rowsOut rows written
     * @return entry with status {@link AuditStatus#OK} and an empty message
     */
    public static AuditLogEntry succeeded(String timestamp, RemoteItem source, String dstId,
            String dstTitle, int rowsIn, int rowsOut) {
        return new AuditLogEntry(timestamp, source.getId(), source.getTitle(),
                source.getModifiedTime(), dstId, dstTitle, rowsIn, rowsOut, AuditStatus.OK, "");
    }

    /**
     * Builds the entry of a failed attempt.
     *
     * @param timestamp attempt time (UTC, ISO-8601)
     * @param source source that failed
     * @param dstTitle intended destination name
     * @param message error text
     * @return entry with status {@link AuditStatus#FAIL}
     */
    public static AuditLogEntry failed(String timestamp, RemoteItem source, String dstTitle,
            String message) {
        return new AuditLogEntry(timestamp, source.getId(), source.getTitle(),
                source.getModifiedTime(), null, dstTitle, null, null, AuditStatus.FAIL, message);
    }

    /**
     * Rebuilds an entry from the cells of a persisted row. Missing trailing cells are read as
     * empty; counts written as {@code 3.0} are accepted.
     *
     * @param cells row cells in {@link #COLUMNS} order
     * @return entry
     */
    public static AuditLogEntry fromCells(List<String> cells) {
        String[] c = Arrays.copyOf(cells.toArray(new String[0]), COLUMNS.size());
        return new AuditLogEntry(c[0], c[1], c[2], c[3], StringUtils.trimToNull(c[4]), c[5],
                parseCount(c[6]), parseCount(c[7]), AuditStatus.fromValue(c[8]).orElse(null),
                StringUtils.defaultIfEmpty(c[9], ""));
    }

    /**
     * Returns the cells of this entry in {@link #COLUMNS} order; {@code null} values become
     * {@code null} cells, written as empty fields.
     *
     * @return row cells
     */
    public List<String> toCells() {
        return Arrays.asList(timestamp, srcId, srcTitle, srcModified, dstId, dstTitle,
                rowsIn == null ? null : rowsIn.toString(),
                rowsOut == null ? null : rowsOut.toString(),
                status == null ? null : status.getValue(), message);
    }

    private static Integer parseCount(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return new BigDecimal(value.trim()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            return null;
        }
    }
}

package io.github.yok.cleansync.transform;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Ordered CSV content: a header and the rows below it.
 *
 * <p>
 * Each row maps column name to cell value in header order. A {@code null} value means the cell is
 * absent (for example a short record, or an encoded column with no mapping).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TabularPayload {

    private final List<String> headers;

    private final List<Map<String, String>> rows;

    /**
     * Creates a payload. Rows are copied in header order.
     *
     * @param headers column names
     * @param rows row maps keyed by column name
     */
    public TabularPayload(List<String> headers, List<Map<String, String>> rows) {
        this.headers = ImmutableList.copyOf(headers);
        List<Map<String, String>> copy = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            Map<String, String> ordered = new LinkedHashMap<>();
            for (String header : this.headers) {
                ordered.put(header, row.get(header));
            }
            copy.add(Collections.unmodifiableMap(ordered));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * @return number of data rows (the header is not counted)
     */
    public int rowCount() {
        return rows.size();
    }

    /**
     * @param column column name
     * @return whether the header contains {@code column}
     */
    public boolean hasColumn(String column) {
        return headers.contains(column);
    }

    /**
     * Returns the rows as cell lists in header order, as expected by
     * {@link io.github.yok.cleansync.util.CsvUtils#writeCsvUtf8}.
     *
     * @return row cells
     */
    public List<List<String>> toRecords() {
        List<List<String>> records = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            records.add(new ArrayList<>(row.values()));
        }
        return records;
    }
}
